package ai.courseware.archiver.document;

import java.util.Locale;

/**
 * Semantic classification assigned to a fragment of page content.
 */
public enum SectionKind {
    NOTE,
    WARNING,
    EXAMPLE,
    INFO,
    ABSTRACT,
    TIP,
    CODE,
    TABLE,
    TEXT;

    public static SectionKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Section kind must be provided");
        }
        for (SectionKind kind : values()) {
            if (kind.name().equalsIgnoreCase(raw.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported section kind: " + raw);
    }

    /**
     * Whether sections of this kind are highlighted as callouts in extended markdown.
     */
    public boolean isCallout() {
        return this != CODE && this != TABLE && this != TEXT;
    }

    public String displayName() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
