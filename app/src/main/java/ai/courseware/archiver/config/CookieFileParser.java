package ai.courseware.archiver.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads browser cookies exported in the Netscape {@code cookies.txt} format and joins the ones
 * that apply to a host into a {@code Cookie} header value.
 */
public class CookieFileParser {

    private static final String HTTP_ONLY_PREFIX = "#HttpOnly_";
    private static final int FIELD_COUNT = 7;

    public String parse(Path cookieFile, String host) {
        try {
            return parse(Files.readString(cookieFile, StandardCharsets.UTF_8), host);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read cookie file: " + cookieFile, ex);
        }
    }

    public String parse(String content, String host) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Cookie file is empty");
        }
        String normalizedHost = host == null ? "" : host.trim().toLowerCase(Locale.ROOT);
        Map<String, String> cookies = new LinkedHashMap<>();
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.strip();
            if (line.startsWith(HTTP_ONLY_PREFIX)) {
                line = line.substring(HTTP_ONLY_PREFIX.length());
            } else if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] fields = line.split("\t");
            if (fields.length < FIELD_COUNT) {
                continue;
            }
            if (matchesDomain(fields[0], normalizedHost)) {
                cookies.put(fields[5].trim(), fields[6].trim());
            }
        }
        if (cookies.isEmpty()) {
            throw new IllegalArgumentException("Cookie file has no cookies for " + host);
        }
        return cookies.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("; "));
    }

    private static boolean matchesDomain(String domainField, String host) {
        String domain = domainField.trim().toLowerCase(Locale.ROOT);
        if (domain.startsWith(".")) {
            domain = domain.substring(1);
        }
        if (domain.isEmpty()) {
            return false;
        }
        return host.equals(domain) || host.endsWith("." + domain);
    }
}
