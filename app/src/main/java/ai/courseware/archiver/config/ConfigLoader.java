package ai.courseware.archiver.config;

import ai.courseware.archiver.cli.CliArguments;
import ai.courseware.archiver.render.FrontMatter;
import ai.courseware.archiver.render.OutputFormat;
import ai.courseware.archiver.render.RenderConfig;
import ai.courseware.archiver.run.RunConfig;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_COURSE_COOKIES = "COURSE_COOKIES";
    static final String ENV_COOKIE_FILE = "COOKIE_FILE";
    static final String ENV_OUTPUT_DIR = "OUTPUT_DIR";
    static final String ENV_OUTPUT_FORMATS = "OUTPUT_FORMATS";
    static final String ENV_RATE_LIMIT_SECONDS = "RATE_LIMIT_SECONDS";
    static final String ENV_MAX_CONSECUTIVE_FAILURES = "MAX_CONSECUTIVE_FAILURES";
    static final String ENV_ALLOWED_HOST = "ALLOWED_HOST";
    static final String ENV_SESSION_COOKIE_NAME = "SESSION_COOKIE_NAME";
    static final String ENV_CONTENT_SELECTORS = "CONTENT_SELECTORS";
    static final String ENV_CLEANUP_SELECTORS = "CLEANUP_SELECTORS";
    static final String ENV_CALLOUTS_ENABLED = "CALLOUTS_ENABLED";
    static final String ENV_EMBED_IMAGES = "EMBED_IMAGES";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_OUTPUT_DIR = "downloads";

    // CSS selector lists contain commas, so selector variables are separated by semicolons.
    private static final String SELECTOR_SEPARATOR = ";";

    private final EnvironmentReader environmentReader;
    private final CookieFileParser cookieFileParser;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, new CookieFileParser());
    }

    public ConfigLoader(EnvironmentReader environmentReader, CookieFileParser cookieFileParser) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.cookieFileParser = Objects.requireNonNull(cookieFileParser, "cookieFileParser");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        LogFormat logFormat = resolveLogFormat(arguments);
        String allowedHost = env(ENV_ALLOWED_HOST).orElse(RunConfig.DEFAULT_ALLOWED_HOST);
        String sessionCookieName = env(ENV_SESSION_COOKIE_NAME).orElse(RunConfig.DEFAULT_SESSION_COOKIE_NAME);
        String credential = resolveCredential(arguments, allowedHost);
        String outputDirectory = firstNonBlank(arguments.outputDirectory(), ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR);

        Duration rateLimit = arguments.rateLimitSeconds() != null
                ? toDuration(arguments.rateLimitSeconds())
                : env(ENV_RATE_LIMIT_SECONDS).map(ConfigLoader::parseSeconds).orElse(RunConfig.DEFAULT_RATE_LIMIT);
        int maxFailures = arguments.maxFailures() != null
                ? arguments.maxFailures()
                : env(ENV_MAX_CONSECUTIVE_FAILURES).map(ConfigLoader::parseInteger)
                        .orElse(RunConfig.DEFAULT_MAX_CONSECUTIVE_FAILURES);

        List<String> contentSelectors = env(ENV_CONTENT_SELECTORS).map(ConfigLoader::parseSelectors).orElse(null);
        List<String> cleanupSelectors = env(ENV_CLEANUP_SELECTORS).map(ConfigLoader::parseSelectors).orElse(null);

        RunConfig runConfig = new RunConfig(credential, outputDirectory, resolveRenderConfig(arguments), rateLimit,
                maxFailures, allowedHost, sessionCookieName, contentSelectors, cleanupSelectors, arguments.timestamp());
        return new Config(arguments.urls(), runConfig, logFormat);
    }

    private RenderConfig resolveRenderConfig(CliArguments arguments) {
        Set<OutputFormat> formats = !arguments.formats().isEmpty()
                ? EnumSet.copyOf(arguments.formats())
                : env(ENV_OUTPUT_FORMATS).map(ConfigLoader::parseFormats).orElse(EnumSet.of(OutputFormat.MARKDOWN));
        boolean callouts = !arguments.noCallouts()
                && env(ENV_CALLOUTS_ENABLED).map(value -> parseBoolean(ENV_CALLOUTS_ENABLED, value)).orElse(true);
        boolean embedImages = !arguments.noEmbedImages()
                && env(ENV_EMBED_IMAGES).map(value -> parseBoolean(ENV_EMBED_IMAGES, value)).orElse(true);
        Optional<FrontMatter> frontMatter = Optional.empty();
        if (arguments.metadata()) {
            FrontMatter defaults = FrontMatter.defaults();
            List<String> tags = arguments.tags().isEmpty() ? defaults.tags() : arguments.tags();
            frontMatter = Optional.of(new FrontMatter(tags, defaults.source(), Optional.empty()));
        }
        return new RenderConfig(formats, callouts, Map.of(), embedImages, !arguments.htmlTables(), frontMatter);
    }

    private String resolveCredential(CliArguments arguments, String allowedHost) {
        if (isNotBlank(arguments.cookies())) {
            return arguments.cookies().trim();
        }
        Optional<String> fromEnv = env(ENV_COURSE_COOKIES);
        if (fromEnv.isPresent()) {
            return fromEnv.get().trim();
        }
        Path cookieFile = arguments.cookieFile() != null
                ? arguments.cookieFile()
                : env(ENV_COOKIE_FILE).map(Path::of).orElse(null);
        if (cookieFile != null) {
            return cookieFileParser.parse(cookieFile, allowedHost);
        }
        return "";
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key).filter(ConfigLoader::isNotBlank).map(String::trim);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return env(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static Duration parseSeconds(String raw) {
        try {
            return toDuration(Double.parseDouble(raw));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_RATE_LIMIT_SECONDS + " must be a number of seconds", ex);
        }
    }

    private static Duration toDuration(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new IllegalArgumentException("Rate limit must be a finite number of seconds");
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private static int parseInteger(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_MAX_CONSECUTIVE_FAILURES + " must be an integer", ex);
        }
    }

    private static boolean parseBoolean(String key, String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false: " + raw);
        };
    }

    private static Set<OutputFormat> parseFormats(String raw) {
        Set<OutputFormat> formats = EnumSet.noneOf(OutputFormat.class);
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(OutputFormat::from)
                .forEach(formats::add);
        return formats;
    }

    private static List<String> parseSelectors(String raw) {
        return Arrays.stream(raw.split(SELECTOR_SEPARATOR))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }
}
