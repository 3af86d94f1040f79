package ai.courseware.archiver.document;

import java.util.Objects;
import java.util.Optional;

/**
 * A classified, self-contained fragment of sanitized page HTML.
 */
public record Section(SectionKind kind, String content, Optional<String> language, Optional<String> title) {

    public Section {
        kind = Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
        if (content.isEmpty()) {
            throw new IllegalArgumentException("Section content must not be empty");
        }
        language = language == null ? Optional.empty() : language.filter(value -> !value.isBlank());
        title = title == null ? Optional.empty() : title.filter(value -> !value.isBlank());
    }

    public static Section of(SectionKind kind, String content) {
        return new Section(kind, content, Optional.empty(), Optional.empty());
    }
}
