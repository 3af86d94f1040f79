package ai.courseware.archiver.render;

import ai.courseware.archiver.document.PageDocument;
import ai.courseware.archiver.segment.CodeLanguageDetector;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a page document into every configured output format.
 *
 * <p>Rendering is a pure function of its arguments: state collected while converting, such as
 * image references, lives in a context created per call and is returned with the result.
 */
public class DocumentRenderer {

    private final MarkdownRenderer markdownRenderer;
    private final HtmlDocumentRenderer htmlRenderer;
    private final PlainTextRenderer textRenderer;

    public DocumentRenderer() {
        this(new CodeLanguageDetector());
    }

    public DocumentRenderer(CodeLanguageDetector languageDetector) {
        CodeBlockFormatter codeBlockFormatter = new CodeBlockFormatter(languageDetector);
        TableFormatter tableFormatter = new TableFormatter();
        MarkdownConverter converter = new MarkdownConverter(tableFormatter, codeBlockFormatter);
        this.markdownRenderer = new MarkdownRenderer(converter, codeBlockFormatter, tableFormatter, new HeadingNormalizer());
        this.htmlRenderer = new HtmlDocumentRenderer();
        this.textRenderer = new PlainTextRenderer();
    }

    public RenderResult render(PageDocument document, RenderConfig config) {
        Objects.requireNonNull(document, "document");
        RenderContext context = new RenderContext(Objects.requireNonNull(config, "config"));
        Map<OutputFormat, String> outputs = new EnumMap<>(OutputFormat.class);
        for (OutputFormat format : config.formats()) {
            String output = switch (format) {
                case MARKDOWN -> markdownRenderer.render(document, context);
                case HTML -> htmlRenderer.render(document);
                case TEXT -> textRenderer.render(document);
            };
            outputs.put(format, output);
        }
        return new RenderResult(outputs, context.imageReferences());
    }
}
