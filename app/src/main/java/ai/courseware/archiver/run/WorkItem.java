package ai.courseware.archiver.run;

import java.net.URI;
import java.util.Objects;

/**
 * A queued page URL and its processing state.
 */
public final class WorkItem {

    private final URI url;
    private final String key;
    private volatile WorkState state = WorkState.PENDING;

    WorkItem(URI url, String key) {
        this.url = Objects.requireNonNull(url, "url");
        this.key = Objects.requireNonNull(key, "key");
    }

    public URI url() {
        return url;
    }

    public String key() {
        return key;
    }

    public WorkState state() {
        return state;
    }

    void transition(WorkState next) {
        this.state = Objects.requireNonNull(next, "next");
    }

    @Override
    public String toString() {
        return "WorkItem[" + key + ", " + state + "]";
    }
}
