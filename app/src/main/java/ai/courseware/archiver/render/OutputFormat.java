package ai.courseware.archiver.render;

import java.util.Locale;

/**
 * Output document formats and their file extensions.
 */
public enum OutputFormat {
    MARKDOWN("md"),
    HTML("html"),
    TEXT("txt");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Output format must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "md", "markdown" -> MARKDOWN;
            case "html", "htm" -> HTML;
            case "txt", "text" -> TEXT;
            default -> throw new IllegalArgumentException("Unsupported output format: " + raw);
        };
    }
}
