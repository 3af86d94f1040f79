package ai.courseware.archiver.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;

class CourseLinkDiscovererTest {

    private final CourseLinkDiscoverer discoverer = new CourseLinkDiscoverer();

    @Test
    void collectsSectionLinksInFirstSeenOrder() {
        String html = "<a href=\"/module/1/section/2\">b</a>"
                + "<a href=\"/module/1/section/1\">a</a>"
                + "<a href=\"/module/1/section/2\">b again</a>"
                + "<a href=\"/module/1\">overview</a>"
                + "<a href=\"/billing\">billing</a>";

        List<String> links = discoverer.discover(URI.create("https://site/course/1"), html);

        assertThat(links).containsExactly("https://site/module/1/section/2", "https://site/module/1/section/1");
    }

    @Test
    void recognizesCourseUrls() {
        assertThat(CourseLinkDiscoverer.isCourseUrl(URI.create("https://site/course/1"))).isTrue();
        assertThat(CourseLinkDiscoverer.isCourseUrl(URI.create("https://site/app/courses/linux"))).isTrue();
        assertThat(CourseLinkDiscoverer.isCourseUrl(URI.create("https://site/module/1/section/2"))).isFalse();
        assertThat(CourseLinkDiscoverer.isCourseUrl(URI.create("https://site/course/1/section/2"))).isFalse();
        assertThat(CourseLinkDiscoverer.isCourseUrl(URI.create("https://site/coursework"))).isFalse();
    }
}
