package ai.courseware.archiver.run;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks run inputs before any network activity.
 */
public class RunValidator {

    private static final Pattern COOKIE_HEADER = Pattern.compile(
            "^[a-zA-Z0-9_-]+=[a-zA-Z0-9_\\-.%]+(?:; [a-zA-Z0-9_-]+=[a-zA-Z0-9_\\-.%]+)*$");

    public List<URI> validate(List<String> urls, RunConfig config) {
        if (config == null) {
            throw new ValidationException("config", "must be provided");
        }
        validateCredential(config.credential(), config.sessionCookieName());
        List<URI> parsed = validateUrls(urls, config.allowedHost());
        validateOutputDirectory(config.outputDirectory());
        if (config.rateLimit().isNegative()) {
            throw new ValidationException("rateLimit", "must not be negative");
        }
        if (config.maxConsecutiveFailures() < 1) {
            throw new ValidationException("maxConsecutiveFailures", "must be at least 1");
        }
        if (config.renderConfig().formats().isEmpty()) {
            throw new ValidationException("formats", "at least one output format is required");
        }
        return parsed;
    }

    void validateCredential(String credential, String sessionCookieName) {
        if (credential == null || credential.isBlank()) {
            throw new ValidationException("cookies", "session cookies must be provided");
        }
        if (!COOKIE_HEADER.matcher(credential.trim()).matches()) {
            throw new ValidationException("cookies", "expected 'name=value' pairs separated by '; '");
        }
        boolean hasSession = false;
        for (String pair : credential.trim().split("; ")) {
            if (pair.substring(0, pair.indexOf('=')).equals(sessionCookieName)) {
                hasSession = true;
                break;
            }
        }
        if (!hasSession) {
            throw new ValidationException("cookies", "missing required cookie '" + sessionCookieName + "'");
        }
    }

    List<URI> validateUrls(List<String> urls, String allowedHost) {
        if (urls == null || urls.isEmpty()) {
            throw new ValidationException("urls", "at least one URL is required");
        }
        List<URI> parsed = new ArrayList<>();
        for (String raw : urls) {
            if (raw == null || raw.isBlank()) {
                throw new ValidationException("urls", "URL must not be blank");
            }
            URI uri;
            try {
                uri = new URI(raw.trim());
            } catch (URISyntaxException ex) {
                throw new ValidationException("urls", "malformed URL '" + raw + "'");
            }
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!uri.isAbsolute() || !("http".equals(scheme) || "https".equals(scheme))) {
                throw new ValidationException("urls", "URL must be absolute http(s): '" + raw + "'");
            }
            if (uri.getHost() == null || !uri.getHost().equalsIgnoreCase(allowedHost)) {
                throw new ValidationException("urls", "URL host must be " + allowedHost + ": '" + raw + "'");
            }
            parsed.add(uri);
        }
        return List.copyOf(parsed);
    }

    void validateOutputDirectory(String outputDirectory) {
        if (outputDirectory == null || outputDirectory.isBlank()) {
            throw new ValidationException("outputDirectory", "must be provided");
        }
        for (String segment : outputDirectory.split("[/\\\\]")) {
            if ("..".equals(segment)) {
                throw new ValidationException("outputDirectory", "must not contain '..' segments");
            }
        }
        try {
            Path.of(outputDirectory);
        } catch (InvalidPathException ex) {
            throw new ValidationException("outputDirectory", "invalid path: " + ex.getMessage());
        }
    }
}
