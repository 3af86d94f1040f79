package ai.courseware.archiver.extract;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Finds the module section pages linked from a course overview page.
 */
public class CourseLinkDiscoverer {

    private static final String SECTION_LINK_SELECTOR = "a[href*=/module/][href*=/section/]";

    public List<String> discover(URI courseUrl, String html) {
        Objects.requireNonNull(courseUrl, "courseUrl");
        Document document = Jsoup.parse(html == null ? "" : html, courseUrl.toString());
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select(SECTION_LINK_SELECTOR)) {
            String resolved = anchor.absUrl("href");
            if (!resolved.isBlank()) {
                links.add(resolved);
            }
        }
        return List.copyOf(links);
    }

    /**
     * Course overview pages carry a {@code course} or {@code courses} path segment and are not section pages.
     */
    public static boolean isCourseUrl(URI url) {
        String path = url.getPath();
        if (path == null || path.contains("/section/")) {
            return false;
        }
        for (String segment : path.split("/")) {
            if (segment.equalsIgnoreCase("course") || segment.equalsIgnoreCase("courses")) {
                return true;
            }
        }
        return false;
    }
}
