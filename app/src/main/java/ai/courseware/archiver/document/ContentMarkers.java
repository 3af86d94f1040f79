package ai.courseware.archiver.document;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Class-name fragments that mark semantic containers on course pages, in classification priority order.
 */
public final class ContentMarkers {

    private static final Map<SectionKind, List<String>> CALLOUT_MARKERS = createCalloutMarkers();
    private static final List<String> CODE_CONTAINER_MARKERS = List.of("highlight", "code-block", "lang-", "language-");

    private ContentMarkers() {
    }

    private static Map<SectionKind, List<String>> createCalloutMarkers() {
        Map<SectionKind, List<String>> markers = new LinkedHashMap<>();
        markers.put(SectionKind.INFO, List.of("info"));
        markers.put(SectionKind.WARNING, List.of("warning", "danger", "caution"));
        markers.put(SectionKind.EXAMPLE, List.of("example", "exercise"));
        markers.put(SectionKind.ABSTRACT, List.of("abstract", "summary", "overview"));
        markers.put(SectionKind.NOTE, List.of("note", "important", "tip"));
        return java.util.Collections.unmodifiableMap(markers);
    }

    public static Map<SectionKind, List<String>> calloutMarkers() {
        return CALLOUT_MARKERS;
    }

    public static boolean hasCalloutMarker(String className) {
        return containsAny(className, CALLOUT_MARKERS.values().stream().flatMap(List::stream).toList());
    }

    public static boolean hasCodeMarker(String className) {
        return containsAny(className, CODE_CONTAINER_MARKERS);
    }

    private static boolean containsAny(String className, List<String> markers) {
        if (className == null || className.isBlank()) {
            return false;
        }
        String normalized = className.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
