package ai.courseware.archiver.run;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import org.junit.jupiter.api.Test;

class WorkQueueTest {

    @Test
    void keepsFirstOccurrenceOfEquivalentUrls() {
        WorkQueue queue = new WorkQueue();

        assertThat(queue.add(URI.create("https://site/module/1/section/1"))).isTrue();
        assertThat(queue.add(URI.create("HTTPS://Site/module/1/section/1#intro"))).isFalse();
        assertThat(queue.add(URI.create("https://site/module/1/./section/1"))).isFalse();
        assertThat(queue.add(URI.create("https://site/module/1/section/2"))).isTrue();

        assertThat(queue.items()).extracting(item -> item.url().toString())
                .containsExactly("https://site/module/1/section/1", "https://site/module/1/section/2");
        assertThat(queue.count(WorkState.PENDING)).isEqualTo(2);
    }

    @Test
    void keepsQueryButDropsFragment() {
        assertThat(WorkQueue.normalize(URI.create("https://Site:8443/a/b/../c?x=1#frag")))
                .isEqualTo("https://site:8443/a/c?x=1");
        assertThat(WorkQueue.normalize(URI.create("https://site"))).isEqualTo("https://site/");
    }
}
