package ai.courseware.archiver.sanitize;

import ai.courseware.archiver.document.ContentMarkers;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Reduces page HTML to an allow-listed subset of content tags.
 *
 * <p>Blocklisted elements are dropped together with their subtrees before any other step, so
 * unwrapping never brings their content back. Non-allow-listed wrappers are unwrapped rather than
 * deleted, except semantic containers carrying a callout marker class, which become
 * {@code blockquote} elements so that classification can still see them. Elements left without
 * content are removed last. Sanitizing already sanitized HTML returns it unchanged.
 */
public class HtmlSanitizer {

    private static final String BLOCKLIST_SELECTOR = String.join(", ",
            "script", "style", "noscript", "template", "title", "head", "iframe", "object", "embed",
            "link", "meta", "nav", "header", "footer", "form", "button", "input", "select", "textarea",
            "canvas", "svg", "[hidden]", "[aria-hidden=true]", "[style~=display:\\s*none]");

    private static final Set<String> ALLOWED_TAGS = Set.of(
            "p", "h1", "h2", "h3", "h4", "h5", "h6",
            "table", "thead", "tbody", "tfoot", "tr", "th", "td", "caption",
            "pre", "code",
            "ul", "ol", "li", "dl", "dt", "dd",
            "strong", "b", "em", "i", "u", "s", "mark", "sub", "sup", "kbd",
            "a", "img", "blockquote", "br", "hr");

    private static final Set<String> CALLOUT_CONTAINERS = Set.of(
            "div", "section", "aside", "article", "details", "figure", "main", "blockquote");

    private static final Set<String> CONTENT_CARRIERS = Set.of("br", "hr", "img", "td", "th", "tr");

    private static final Map<String, Set<String>> ALLOWED_ATTRIBUTES = Map.of(
            "a", Set.of("href", "title"),
            "img", Set.of("src", "alt", "title"),
            "pre", Set.of("class"),
            "code", Set.of("class"),
            "p", Set.of("class"),
            "blockquote", Set.of("class", "title", "data-title"),
            "td", Set.of("colspan", "rowspan"),
            "th", Set.of("colspan", "rowspan"));

    public String sanitize(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parseBodyFragment(html);
        document.outputSettings().prettyPrint(false);
        Element body = document.body();

        body.select(BLOCKLIST_SELECTOR).remove();
        reduceToAllowList(body);
        stripLeadingPreformattedNewlines(body);
        removeEmptyElements(body);
        return body.html();
    }

    private void reduceToAllowList(Element body) {
        for (Element element : body.getAllElements()) {
            if (element == body) {
                continue;
            }
            String tag = element.normalName();
            if (ALLOWED_TAGS.contains(tag)) {
                filterAttributes(element, tag);
            } else if (CALLOUT_CONTAINERS.contains(tag) && ContentMarkers.hasCalloutMarker(element.className())) {
                element.tagName("blockquote");
                filterAttributes(element, "blockquote");
            } else {
                if (ContentMarkers.hasCodeMarker(element.className())) {
                    handOverCodeClass(element);
                }
                element.unwrap();
            }
        }
    }

    private void filterAttributes(Element element, String tag) {
        Set<String> allowed = ALLOWED_ATTRIBUTES.getOrDefault(tag, Set.of());
        List<String> keys = new ArrayList<>();
        for (Attribute attribute : element.attributes()) {
            keys.add(attribute.getKey());
        }
        for (String key : keys) {
            if (!allowed.contains(key.toLowerCase(Locale.ROOT))) {
                element.removeAttr(key);
            }
        }
        if ("a".equals(tag) && element.attr("href").trim().toLowerCase(Locale.ROOT).startsWith("javascript:")) {
            element.removeAttr("href");
        }
    }

    private void handOverCodeClass(Element container) {
        Element pre = container.selectFirst("pre");
        if (pre != null && pre.className().isBlank()) {
            pre.attr("class", container.className());
        }
    }

    // The HTML parser drops one newline right after <pre>, so leading newlines would not survive a reparse.
    private void stripLeadingPreformattedNewlines(Element body) {
        for (Element pre : body.select("pre")) {
            if (pre.childNodeSize() == 0) {
                continue;
            }
            Node first = pre.childNode(0);
            if (first instanceof TextNode textNode) {
                String text = textNode.getWholeText();
                int index = 0;
                while (index < text.length() && (text.charAt(index) == '\n' || text.charAt(index) == '\r')) {
                    index++;
                }
                if (index > 0) {
                    textNode.text(text.substring(index));
                }
            }
        }
    }

    private void removeEmptyElements(Element body) {
        List<Element> elements = new ArrayList<>(body.getAllElements());
        for (int i = elements.size() - 1; i >= 0; i--) {
            Element element = elements.get(i);
            if (element == body || CONTENT_CARRIERS.contains(element.normalName())) {
                continue;
            }
            if (!element.hasText() && element.selectFirst("img, br, hr") == null) {
                element.remove();
            }
        }
    }
}
