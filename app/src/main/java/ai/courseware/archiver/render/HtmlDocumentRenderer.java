package ai.courseware.archiver.render;

import ai.courseware.archiver.document.PageDocument;
import org.jsoup.nodes.Entities;

/**
 * Wraps sanitized page HTML into a minimal standalone document.
 */
class HtmlDocumentRenderer {

    private static final String STYLE = """
                body { font-family: -apple-system, BlinkMacSystemFont, "Segoe UI", Roboto, sans-serif; line-height: 1.6; max-width: 900px; margin: 0 auto; padding: 2rem; color: #1f2328; }
                pre { background: #f6f8fa; padding: 1rem; overflow-x: auto; border-radius: 6px; }
                code { font-family: SFMono-Regular, Consolas, "Liberation Mono", monospace; }
                table { border-collapse: collapse; }
                th, td { border: 1px solid #d0d7de; padding: 0.4rem 0.8rem; }
                blockquote { border-left: 4px solid #d0d7de; margin: 0; padding: 0 1rem; color: #57606a; }
                img { max-width: 100%; }
            """;

    String render(PageDocument document) {
        String title = Entities.escape(document.title());
        return "<!DOCTYPE html>\n"
                + "<html>\n"
                + "<head>\n"
                + "    <meta charset=\"utf-8\">\n"
                + "    <title>" + title + "</title>\n"
                + "    <style>\n" + STYLE
                + "    </style>\n"
                + "</head>\n"
                + "<body>\n"
                + "<h1>" + title + "</h1>\n"
                + document.sanitizedHtml() + "\n"
                + "</body>\n"
                + "</html>\n";
    }
}
