package ai.courseware.archiver.render;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata block written at the top of extended markdown output.
 */
public record FrontMatter(List<String> tags, Optional<String> source, Optional<Instant> created) {

    public static final List<String> DEFAULT_TAGS = List.of("courseware");
    public static final String DEFAULT_SOURCE = "Courseware Archiver";

    public FrontMatter {
        tags = tags == null ? List.of() : List.copyOf(tags);
        source = source == null ? Optional.empty() : source.filter(value -> !value.isBlank());
        created = created == null ? Optional.empty() : created;
    }

    public static FrontMatter defaults() {
        return new FrontMatter(DEFAULT_TAGS, Optional.of(DEFAULT_SOURCE), Optional.empty());
    }

    public FrontMatter withCreated(Instant timestamp) {
        return new FrontMatter(tags, source, Optional.of(Objects.requireNonNull(timestamp, "timestamp")));
    }

    /**
     * Entries in output order; list values are kept as lists.
     */
    public Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        if (!tags.isEmpty()) {
            entries.put("tags", tags);
        }
        created.ifPresent(value -> entries.put("created", value.toString()));
        source.ifPresent(value -> entries.put("source", value));
        return entries;
    }

    public String toMarkdown() {
        StringBuilder builder = new StringBuilder("---\n");
        for (Map.Entry<String, Object> entry : entries().entrySet()) {
            builder.append(entry.getKey()).append(": ").append(formatValue(entry.getValue())).append('\n');
        }
        return builder.append("---\n").toString();
    }

    private static String formatValue(Object value) {
        if (value instanceof List<?> list) {
            StringBuilder builder = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(list.get(i));
            }
            return builder.append(']').toString();
        }
        return String.valueOf(value);
    }
}
