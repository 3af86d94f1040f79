package ai.courseware.archiver.run;

import ai.courseware.archiver.extract.ContentExtractor;
import ai.courseware.archiver.render.RenderConfig;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings for a single download run.
 */
public record RunConfig(String credential,
                        String outputDirectory,
                        RenderConfig renderConfig,
                        Duration rateLimit,
                        int maxConsecutiveFailures,
                        String allowedHost,
                        String sessionCookieName,
                        List<String> contentSelectors,
                        List<String> cleanupSelectors,
                        boolean includeTimestamp) {

    public static final Duration DEFAULT_RATE_LIMIT = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 3;
    public static final String DEFAULT_ALLOWED_HOST = "academy.hackthebox.com";
    public static final String DEFAULT_SESSION_COOKIE_NAME = "htb_academy_session";

    public RunConfig {
        credential = Objects.requireNonNullElse(credential, "");
        outputDirectory = Objects.requireNonNullElse(outputDirectory, "");
        renderConfig = renderConfig == null ? RenderConfig.defaults() : renderConfig;
        rateLimit = rateLimit == null ? DEFAULT_RATE_LIMIT : rateLimit;
        allowedHost = allowedHost == null || allowedHost.isBlank() ? DEFAULT_ALLOWED_HOST : allowedHost.trim();
        sessionCookieName = sessionCookieName == null || sessionCookieName.isBlank()
                ? DEFAULT_SESSION_COOKIE_NAME
                : sessionCookieName.trim();
        contentSelectors = contentSelectors == null || contentSelectors.isEmpty()
                ? ContentExtractor.DEFAULT_CONTENT_SELECTORS
                : List.copyOf(contentSelectors);
        cleanupSelectors = cleanupSelectors == null
                ? ContentExtractor.DEFAULT_CLEANUP_SELECTORS
                : List.copyOf(cleanupSelectors);
    }

    public static RunConfig defaults(String credential, String outputDirectory) {
        return new RunConfig(credential, outputDirectory, RenderConfig.defaults(), DEFAULT_RATE_LIMIT,
                DEFAULT_MAX_CONSECUTIVE_FAILURES, DEFAULT_ALLOWED_HOST, DEFAULT_SESSION_COOKIE_NAME,
                null, null, false);
    }

    public RunConfig withRenderConfig(RenderConfig value) {
        return new RunConfig(credential, outputDirectory, value, rateLimit, maxConsecutiveFailures, allowedHost,
                sessionCookieName, contentSelectors, cleanupSelectors, includeTimestamp);
    }

    public RunConfig withRateLimit(Duration value) {
        return new RunConfig(credential, outputDirectory, renderConfig, value, maxConsecutiveFailures, allowedHost,
                sessionCookieName, contentSelectors, cleanupSelectors, includeTimestamp);
    }

    public RunConfig withMaxConsecutiveFailures(int value) {
        return new RunConfig(credential, outputDirectory, renderConfig, rateLimit, value, allowedHost,
                sessionCookieName, contentSelectors, cleanupSelectors, includeTimestamp);
    }

    public RunConfig withAllowedHost(String value) {
        return new RunConfig(credential, outputDirectory, renderConfig, rateLimit, maxConsecutiveFailures, value,
                sessionCookieName, contentSelectors, cleanupSelectors, includeTimestamp);
    }

    public RunConfig withSessionCookieName(String value) {
        return new RunConfig(credential, outputDirectory, renderConfig, rateLimit, maxConsecutiveFailures, allowedHost,
                value, contentSelectors, cleanupSelectors, includeTimestamp);
    }

    public RunConfig withSelectors(List<String> content, List<String> cleanup) {
        return new RunConfig(credential, outputDirectory, renderConfig, rateLimit, maxConsecutiveFailures, allowedHost,
                sessionCookieName, content, cleanup, includeTimestamp);
    }

    public RunConfig withIncludeTimestamp(boolean value) {
        return new RunConfig(credential, outputDirectory, renderConfig, rateLimit, maxConsecutiveFailures, allowedHost,
                sessionCookieName, contentSelectors, cleanupSelectors, value);
    }

    @Override
    public String toString() {
        return "RunConfig[outputDirectory=" + outputDirectory
                + ", renderConfig=" + renderConfig
                + ", rateLimit=" + rateLimit
                + ", maxConsecutiveFailures=" + maxConsecutiveFailures
                + ", allowedHost=" + allowedHost
                + ", sessionCookieName=" + sessionCookieName
                + ", includeTimestamp=" + includeTimestamp
                + ", credential=****]";
    }
}
