package ai.courseware.archiver.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Converts sanitized HTML fragments to markdown by walking the jsoup tree.
 */
class MarkdownConverter {

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "h1", "h2", "h3", "h4", "h5", "h6", "ul", "ol", "dl", "dt", "dd", "pre", "blockquote", "hr",
            "table", "div", "section", "article", "figure", "li");

    private static final Pattern INLINE_SPECIAL = Pattern.compile("[\\\\*_`\\[\\]<>#]");
    private static final Pattern ORDERED_MARKER = Pattern.compile("^(\\d+)([.)])(?=\\s|$)");
    private static final Pattern BULLET_MARKER = Pattern.compile("^([-+])(?=\\s|$)");

    private final TableFormatter tableFormatter;
    private final CodeBlockFormatter codeBlockFormatter;

    MarkdownConverter(TableFormatter tableFormatter, CodeBlockFormatter codeBlockFormatter) {
        this.tableFormatter = tableFormatter;
        this.codeBlockFormatter = codeBlockFormatter;
    }

    String convert(String html, RenderContext context) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parseBodyFragment(html);
        return blocks(document.body(), context, "\n\n").strip();
    }

    private String blocks(Element parent, RenderContext context, String separator) {
        List<String> blocks = new ArrayList<>();
        StringBuilder inline = new StringBuilder();
        for (Node node : parent.childNodes()) {
            if (node instanceof Element element && BLOCK_TAGS.contains(element.normalName())) {
                flushParagraph(inline, blocks);
                String block = block(element, context);
                if (!block.isBlank()) {
                    blocks.add(block);
                }
            } else {
                inline.append(inline(node, context));
            }
        }
        flushParagraph(inline, blocks);
        return String.join(separator, blocks);
    }

    private static void flushParagraph(StringBuilder inline, List<String> blocks) {
        String paragraph = tidyParagraph(inline.toString());
        if (!paragraph.isEmpty()) {
            blocks.add(paragraph);
        }
        inline.setLength(0);
    }

    // A line break leaves the following text starting with the collapsed space of the source markup.
    private static String tidyParagraph(String text) {
        StringBuilder out = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(escapeLineStart(line.stripLeading()));
        }
        return out.toString().strip();
    }

    private String block(Element element, RenderContext context) {
        String tag = element.normalName();
        return switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                String text = tidyParagraph(inlineChildren(element, context)).replace('\n', ' ');
                yield text.isEmpty() ? "" : "#".repeat(tag.charAt(1) - '0') + " " + text;
            }
            case "p", "dt" -> tidyParagraph(inlineChildren(element, context));
            case "dd" -> indent(blocks(element, context, "\n\n"), ": ", "  ");
            case "ul", "ol" -> list(element, context);
            case "li" -> indent(blocks(element, context, "\n"), "- ", "  ");
            case "pre" -> codeBlockFormatter.fence(element.wholeText(), codeBlockFormatter.languageOf(element));
            case "blockquote" -> quote(blocks(element, context, "\n\n"));
            case "hr" -> "---";
            case "table" -> context.config().pipeTables() ? tableFormatter.format(element, this, context) : element.outerHtml();
            default -> blocks(element, context, "\n\n");
        };
    }

    private String list(Element list, RenderContext context) {
        boolean ordered = "ol".equals(list.normalName());
        int number = 1;
        if (ordered && list.hasAttr("start")) {
            try {
                number = Integer.parseInt(list.attr("start").trim());
            } catch (NumberFormatException ex) {
                number = 1;
            }
        }
        List<String> items = new ArrayList<>();
        for (Element child : list.children()) {
            if (!"li".equals(child.normalName())) {
                continue;
            }
            String marker = ordered ? (number++) + ". " : "- ";
            String content = blocks(child, context, "\n");
            items.add(indent(content, marker, " ".repeat(marker.length())));
        }
        return String.join("\n", items);
    }

    String inlineChildren(Element element, RenderContext context) {
        StringBuilder builder = new StringBuilder();
        for (Node child : element.childNodes()) {
            builder.append(inline(child, context));
        }
        return builder.toString();
    }

    private String inline(Node node, RenderContext context) {
        if (node instanceof TextNode text) {
            return escapeText(collapseWhitespace(text.getWholeText()));
        }
        if (!(node instanceof Element element)) {
            return "";
        }
        return switch (element.normalName()) {
            case "strong", "b" -> emphasis(inlineChildren(element, context), "**");
            case "em", "i" -> emphasis(inlineChildren(element, context), "*");
            case "s" -> emphasis(inlineChildren(element, context), "~~");
            case "mark" -> emphasis(inlineChildren(element, context), "==");
            case "code", "kbd" -> inlineCode(element.wholeText());
            case "br" -> "\n";
            case "img" -> context.image(element.attr("src"), element.attr("alt"));
            case "a" -> link(element, context);
            default -> inlineChildren(element, context);
        };
    }

    private String link(Element anchor, RenderContext context) {
        String text = inlineChildren(anchor, context);
        String href = anchor.attr("href").trim();
        if (href.isEmpty()) {
            return text;
        }
        String label = text.strip();
        if (label.isEmpty()) {
            label = href;
        }
        return leadingSpace(text) + "[" + label + "](" + href.replace(" ", "%20") + ")" + trailingSpace(text);
    }

    private static String emphasis(String content, String marker) {
        String core = content.strip();
        if (core.isEmpty()) {
            return content;
        }
        return leadingSpace(content) + marker + core + marker + trailingSpace(content);
    }

    private static String inlineCode(String code) {
        String value = code.replace('\n', ' ');
        if (value.isBlank()) {
            return value;
        }
        if (!value.contains("`")) {
            return "`" + value + "`";
        }
        String fence = "`".repeat(CodeBlockFormatter.longestBacktickRun(value) + 1);
        return fence + " " + value + " " + fence;
    }

    private static String escapeText(String text) {
        return INLINE_SPECIAL.matcher(text).replaceAll("\\\\$0");
    }

    // List markers only take effect at the start of a line.
    private static String escapeLineStart(String line) {
        String escaped = ORDERED_MARKER.matcher(line).replaceFirst("$1\\\\$2");
        return BULLET_MARKER.matcher(escaped).replaceFirst("\\\\$1");
    }

    private static String collapseWhitespace(String text) {
        return text.replaceAll("[ \\t\\r\\n\\f\\u00A0]+", " ");
    }

    private static String leadingSpace(String text) {
        return !text.isEmpty() && Character.isWhitespace(text.charAt(0)) ? " " : "";
    }

    private static String trailingSpace(String text) {
        return !text.isEmpty() && Character.isWhitespace(text.charAt(text.length() - 1)) ? " " : "";
    }

    static String indent(String content, String firstPrefix, String continuationPrefix) {
        String[] lines = content.split("\n", -1);
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }
            if (i == 0) {
                builder.append(firstPrefix).append(lines[i]);
            } else if (!lines[i].isEmpty()) {
                builder.append(continuationPrefix).append(lines[i]);
            }
        }
        return builder.toString();
    }

    static String quote(String content) {
        if (content.isEmpty()) {
            return ">";
        }
        StringBuilder builder = new StringBuilder();
        for (String line : content.split("\n", -1)) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(line.isEmpty() ? ">" : "> " + line);
        }
        return builder.toString();
    }
}
