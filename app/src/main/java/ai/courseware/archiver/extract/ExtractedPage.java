package ai.courseware.archiver.extract;

import java.util.Objects;

/**
 * Title and instructional content region taken from a raw course page.
 */
public record ExtractedPage(String title, String contentHtml) {

    public ExtractedPage {
        title = Objects.requireNonNull(title, "title");
        contentHtml = Objects.requireNonNull(contentHtml, "contentHtml");
    }
}
