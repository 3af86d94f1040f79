package ai.courseware.archiver.extract;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the instructional part of a course page and strips the surrounding site chrome.
 */
public class ContentExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentExtractor.class);

    public static final List<String> DEFAULT_CONTENT_SELECTORS = List.of(
            "div.module-content",
            "div.training-module",
            "div.modal-body",
            "article");

    public static final List<String> DEFAULT_CLEANUP_SELECTORS = List.of(
            "#pwnboxSwitchWarningModal",
            "#solutionsModuleSetting",
            "#statusText",
            "#vpn-switch",
            ".vpnSelector",
            ".pwnbox-select-card",
            "#screen",
            "#questionsDiv",
            ".footer",
            "canvas",
            ".instance-button",
            ".terminateInstanceBtn");

    private static final String UNTITLED = "untitled";

    private final List<String> contentSelectors;
    private final List<String> cleanupSelectors;

    public ContentExtractor() {
        this(DEFAULT_CONTENT_SELECTORS, DEFAULT_CLEANUP_SELECTORS);
    }

    public ContentExtractor(List<String> contentSelectors, List<String> cleanupSelectors) {
        this.contentSelectors = contentSelectors == null || contentSelectors.isEmpty()
                ? DEFAULT_CONTENT_SELECTORS
                : List.copyOf(contentSelectors);
        this.cleanupSelectors = cleanupSelectors == null ? List.of() : List.copyOf(cleanupSelectors);
    }

    public ExtractedPage extract(URI url, String html) {
        Objects.requireNonNull(url, "url");
        Document document = Jsoup.parse(html == null ? "" : html, url.toString());
        document.outputSettings().prettyPrint(false);
        Element heading = document.selectFirst("h1");
        String title = heading == null ? "" : heading.text().trim();
        if (title.isEmpty()) {
            title = lastPathSegment(url);
        }

        Element content = locateContent(document);
        if (content == null) {
            throw new ExtractionException("No content found on page " + url);
        }
        for (String selector : cleanupSelectors) {
            content.select(selector).remove();
        }
        if (heading != null && isDescendant(heading, content)) {
            heading.remove();
        }
        absolutizeReferences(content);
        LOGGER.debug("Extracted '{}' from {}", title, url);
        return new ExtractedPage(title, content.html());
    }

    private Element locateContent(Document document) {
        for (String selector : contentSelectors) {
            Element candidate = document.selectFirst(selector);
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private static void absolutizeReferences(Element content) {
        for (Element link : content.select("a[href]")) {
            String absolute = link.absUrl("href");
            if (!absolute.isEmpty()) {
                link.attr("href", absolute);
            }
        }
        for (Element image : content.select("img[src]")) {
            String absolute = image.absUrl("src");
            if (!absolute.isEmpty()) {
                image.attr("src", absolute);
            }
        }
    }

    private static boolean isDescendant(Element element, Element ancestor) {
        for (Element current = element.parent(); current != null; current = current.parent()) {
            if (current == ancestor) {
                return true;
            }
        }
        return false;
    }

    static String lastPathSegment(URI url) {
        String path = url.getPath();
        if (path == null) {
            return UNTITLED;
        }
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isBlank()) {
                return segments[i];
            }
        }
        return UNTITLED;
    }
}
