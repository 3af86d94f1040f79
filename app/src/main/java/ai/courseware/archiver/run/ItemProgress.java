package ai.courseware.archiver.run;

import java.util.Objects;
import java.util.Optional;

/**
 * Progress of one work item. {@code current} is 1-based.
 */
public record ItemProgress(int current,
                           int total,
                           String url,
                           String filename,
                           ItemStatus status,
                           Optional<String> error) implements RunEvent {

    public ItemProgress {
        url = Objects.requireNonNull(url, "url");
        filename = Objects.requireNonNullElse(filename, "");
        status = Objects.requireNonNull(status, "status");
        error = error == null ? Optional.empty() : error;
    }

    public static ItemProgress downloading(int current, int total, String url) {
        return new ItemProgress(current, total, url, "", ItemStatus.DOWNLOADING, Optional.empty());
    }

    public static ItemProgress processing(int current, int total, String url, String filename) {
        return new ItemProgress(current, total, url, filename, ItemStatus.PROCESSING, Optional.empty());
    }

    public static ItemProgress completed(int current, int total, String url, String filename) {
        return new ItemProgress(current, total, url, filename, ItemStatus.COMPLETED, Optional.empty());
    }

    public static ItemProgress error(int current, int total, String url, String filename, String message) {
        return new ItemProgress(current, total, url, filename, ItemStatus.ERROR, Optional.ofNullable(message));
    }
}
