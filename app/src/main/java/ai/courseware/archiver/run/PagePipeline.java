package ai.courseware.archiver.run;

import ai.courseware.archiver.document.PageDocument;
import ai.courseware.archiver.document.Section;
import ai.courseware.archiver.extract.ContentExtractor;
import ai.courseware.archiver.extract.CourseLinkDiscoverer;
import ai.courseware.archiver.extract.ExtractedPage;
import ai.courseware.archiver.extract.ExtractionException;
import ai.courseware.archiver.fetch.PageFetcher;
import ai.courseware.archiver.render.DocumentRenderer;
import ai.courseware.archiver.render.RenderConfig;
import ai.courseware.archiver.render.RenderResult;
import ai.courseware.archiver.sanitize.HtmlSanitizer;
import ai.courseware.archiver.segment.SectionSegmenter;
import ai.courseware.archiver.writer.DocumentWriter;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-page work: fetch and extract, then sanitize, segment, render and write.
 */
public class PagePipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(PagePipeline.class);

    private final PageFetcher fetcher;
    private final CourseLinkDiscoverer linkDiscoverer;
    private final HtmlSanitizer sanitizer;
    private final SectionSegmenter segmenter;
    private final DocumentRenderer renderer;
    private final DocumentWriter writer;

    public PagePipeline(PageFetcher fetcher) {
        this(fetcher, new CourseLinkDiscoverer(), new HtmlSanitizer(), new SectionSegmenter(),
                new DocumentRenderer(), new DocumentWriter());
    }

    public PagePipeline(PageFetcher fetcher,
                        CourseLinkDiscoverer linkDiscoverer,
                        HtmlSanitizer sanitizer,
                        SectionSegmenter segmenter,
                        DocumentRenderer renderer,
                        DocumentWriter writer) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.linkDiscoverer = Objects.requireNonNull(linkDiscoverer, "linkDiscoverer");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public List<String> discover(URI courseUrl, RunConfig config) {
        String html = fetcher.fetch(courseUrl, config.credential());
        return linkDiscoverer.discover(courseUrl, html);
    }

    public ExtractedPage download(URI url, RunConfig config) {
        String html = fetcher.fetch(url, config.credential());
        ContentExtractor extractor = new ContentExtractor(config.contentSelectors(), config.cleanupSelectors());
        return extractor.extract(url, html);
    }

    public List<Path> convert(URI url, ExtractedPage page, String fileName, RenderConfig renderConfig, Path outputDirectory) {
        String sanitized = sanitizer.sanitize(page.contentHtml());
        if (sanitized.isBlank()) {
            throw new ExtractionException("Page content is empty after sanitizing: " + url);
        }
        List<Section> sections = segmenter.segment(sanitized);
        PageDocument document = new PageDocument(page.title(), url.toString(), sanitized, sections);
        RenderResult result = renderer.render(document, renderConfig);
        if (!result.imageReferences().isEmpty()) {
            LOGGER.debug("{} references {} images", url, result.imageReferences().size());
        }
        return writer.write(outputDirectory, fileName, result.outputs());
    }
}
