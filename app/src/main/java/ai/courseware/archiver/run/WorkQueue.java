package ai.courseware.archiver.run;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of work items keyed by normalized URL; the first occurrence of a URL wins.
 */
public class WorkQueue {

    private final Map<String, WorkItem> items = new LinkedHashMap<>();

    public synchronized boolean add(URI url) {
        String key = normalize(url);
        if (items.containsKey(key)) {
            return false;
        }
        items.put(key, new WorkItem(url, key));
        return true;
    }

    public synchronized List<WorkItem> items() {
        return List.copyOf(items.values());
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized int count(WorkState state) {
        return (int) items.values().stream().filter(item -> item.state() == state).count();
    }

    /**
     * Lower-cases scheme and host, normalizes the path and drops the fragment.
     */
    public static String normalize(URI url) {
        Objects.requireNonNull(url, "url");
        URI normalized = url.normalize();
        StringBuilder builder = new StringBuilder();
        if (normalized.getScheme() != null) {
            builder.append(normalized.getScheme().toLowerCase(Locale.ROOT)).append("://");
        }
        if (normalized.getRawAuthority() != null) {
            String host = normalized.getHost();
            if (host != null) {
                if (normalized.getRawUserInfo() != null) {
                    builder.append(normalized.getRawUserInfo()).append('@');
                }
                builder.append(host.toLowerCase(Locale.ROOT));
                if (normalized.getPort() != -1) {
                    builder.append(':').append(normalized.getPort());
                }
            } else {
                builder.append(normalized.getRawAuthority());
            }
        }
        String path = normalized.getRawPath();
        builder.append(path == null || path.isEmpty() ? "/" : path);
        if (normalized.getRawQuery() != null) {
            builder.append('?').append(normalized.getRawQuery());
        }
        return builder.toString();
    }
}
