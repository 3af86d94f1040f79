package ai.courseware.archiver.render;

import ai.courseware.archiver.document.PageDocument;
import ai.courseware.archiver.document.Section;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

/**
 * Renders a page as extended markdown with optional front matter and callout blocks.
 */
class MarkdownRenderer {

    private final MarkdownConverter converter;
    private final CodeBlockFormatter codeBlockFormatter;
    private final TableFormatter tableFormatter;
    private final HeadingNormalizer headingNormalizer;

    MarkdownRenderer(MarkdownConverter converter,
                     CodeBlockFormatter codeBlockFormatter,
                     TableFormatter tableFormatter,
                     HeadingNormalizer headingNormalizer) {
        this.converter = converter;
        this.codeBlockFormatter = codeBlockFormatter;
        this.tableFormatter = tableFormatter;
        this.headingNormalizer = headingNormalizer;
    }

    String render(PageDocument document, RenderContext context) {
        RenderConfig config = context.config();
        StringBuilder builder = new StringBuilder();
        config.frontMatter().ifPresent(frontMatter -> builder.append(frontMatter.toMarkdown()).append('\n'));
        builder.append(headingNormalizer.formatTitle(document.title()));

        List<String> blocks = new ArrayList<>();
        for (Section section : document.sections()) {
            String block = renderSection(section, context);
            if (!block.isBlank()) {
                blocks.add(block);
            }
        }
        for (String block : blocks) {
            builder.append("\n\n").append(block);
        }
        return builder.append('\n').toString();
    }

    private String renderSection(Section section, RenderContext context) {
        RenderConfig config = context.config();
        return switch (section.kind()) {
            case CODE -> renderCode(section);
            case TABLE -> config.pipeTables() ? tableFormatter.format(firstTable(section), converter, context) : section.content().strip();
            default -> {
                String body = headingNormalizer.shiftHeadings(converter.convert(section.content(), context));
                if (config.calloutsEnabled() && section.kind().isCallout()) {
                    yield callout(section, body, config);
                }
                yield section.title().map(title -> "## " + title + (body.isEmpty() ? "" : "\n\n" + body)).orElse(body);
            }
        };
    }

    private String renderCode(Section section) {
        Element pre = Jsoup.parseBodyFragment(section.content()).selectFirst("pre");
        String code = pre == null ? Jsoup.parseBodyFragment(section.content()).body().wholeText() : pre.wholeText();
        return codeBlockFormatter.fence(code, section.language());
    }

    private static Element firstTable(Section section) {
        Element table = Jsoup.parseBodyFragment(section.content()).selectFirst("table");
        if (table == null) {
            throw new RenderException("Table section does not contain a table");
        }
        return table;
    }

    private static String callout(Section section, String body, RenderConfig config) {
        String header = "> [!" + config.calloutToken(section.kind()) + "] "
                + section.title().orElse(section.kind().displayName());
        if (body.isEmpty()) {
            return header;
        }
        return header + "\n" + MarkdownConverter.quote(body);
    }
}
