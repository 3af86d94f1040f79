package ai.courseware.archiver.document;

import java.util.List;
import java.util.Objects;

/**
 * Result of running the transformation pipeline over one page, handed to the renderer.
 */
public record PageDocument(String title, String sourceUrl, String sanitizedHtml, List<Section> sections) {

    public PageDocument {
        title = Objects.requireNonNull(title, "title");
        sourceUrl = Objects.requireNonNullElse(sourceUrl, "");
        sanitizedHtml = Objects.requireNonNullElse(sanitizedHtml, "");
        sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    }
}
