package ai.courseware.archiver.render;

import ai.courseware.archiver.document.PageDocument;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * Renders a page as plain text: an underlined title followed by markup-free paragraphs.
 */
class PlainTextRenderer {

    private static final Set<String> PARAGRAPH_TAGS = Set.of(
            "p", "h1", "h2", "h3", "h4", "h5", "h6", "pre", "blockquote", "table", "ul", "ol", "dl", "hr");
    private static final Set<String> LINE_TAGS = Set.of("li", "tr", "dt", "dd", "br");

    String render(PageDocument document) {
        String title = document.title().strip();
        StringBuilder builder = new StringBuilder(title).append('\n').append("=".repeat(title.length())).append("\n\n");
        TextCollector collector = new TextCollector();
        NodeTraversor.traverse(collector, Jsoup.parseBodyFragment(document.sanitizedHtml()).body());
        return builder.append(collector.text()).append('\n').toString();
    }

    private static final class TextCollector implements NodeVisitor {

        private final StringBuilder text = new StringBuilder();
        private int preDepth;

        @Override
        public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
                if (preDepth > 0) {
                    text.append(textNode.getWholeText());
                } else {
                    String value = textNode.getWholeText().replaceAll("\\s+", " ");
                    if (atLineStart()) {
                        value = value.stripLeading();
                    }
                    text.append(value);
                }
            } else if (node instanceof Element element) {
                String tag = element.normalName();
                if ("pre".equals(tag)) {
                    preDepth++;
                }
                if (PARAGRAPH_TAGS.contains(tag)) {
                    breakParagraph();
                } else if ("td".equals(tag) || "th".equals(tag)) {
                    if (!atLineStart()) {
                        text.append('\t');
                    }
                } else if ("li".equals(tag)) {
                    breakLine();
                    text.append("- ");
                } else if (LINE_TAGS.contains(tag)) {
                    breakLine();
                }
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (node instanceof Element element) {
                String tag = element.normalName();
                if ("pre".equals(tag)) {
                    preDepth--;
                }
                if (PARAGRAPH_TAGS.contains(tag)) {
                    breakParagraph();
                }
            }
        }

        private boolean atLineStart() {
            return text.length() == 0 || text.charAt(text.length() - 1) == '\n';
        }

        private void breakLine() {
            trimTrailingSpaces();
            if (!atLineStart()) {
                text.append('\n');
            }
        }

        private void breakParagraph() {
            trimTrailingSpaces();
            if (text.length() == 0) {
                return;
            }
            if (!atLineStart()) {
                text.append('\n');
            }
            if (text.length() < 2 || text.charAt(text.length() - 2) != '\n') {
                text.append('\n');
            }
        }

        private void trimTrailingSpaces() {
            int end = text.length();
            while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
                end--;
            }
            text.setLength(end);
        }

        String text() {
            return text.toString().strip();
        }
    }
}
