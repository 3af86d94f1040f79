package ai.courseware.archiver.segment;

import ai.courseware.archiver.document.SectionKind;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies prose by the keyword it opens with, such as {@code Note:} or {@code Warning:}.
 */
public class LexicalClassifier {

    private static final Map<String, SectionKind> LEADING_KEYWORDS = createKeywords();

    private static Map<String, SectionKind> createKeywords() {
        Map<String, SectionKind> keywords = new LinkedHashMap<>();
        keywords.put("note:", SectionKind.NOTE);
        keywords.put("important:", SectionKind.NOTE);
        keywords.put("remember:", SectionKind.NOTE);
        keywords.put("tip:", SectionKind.TIP);
        keywords.put("hint:", SectionKind.TIP);
        keywords.put("warning:", SectionKind.WARNING);
        keywords.put("caution:", SectionKind.WARNING);
        keywords.put("danger:", SectionKind.WARNING);
        keywords.put("example:", SectionKind.EXAMPLE);
        keywords.put("exercise:", SectionKind.EXAMPLE);
        keywords.put("task:", SectionKind.EXAMPLE);
        keywords.put("summary:", SectionKind.ABSTRACT);
        keywords.put("abstract:", SectionKind.ABSTRACT);
        keywords.put("overview:", SectionKind.ABSTRACT);
        keywords.put("info:", SectionKind.INFO);
        keywords.put("information:", SectionKind.INFO);
        return java.util.Collections.unmodifiableMap(keywords);
    }

    public Optional<SectionKind> classify(String flattenedText) {
        if (flattenedText == null) {
            return Optional.empty();
        }
        String normalized = flattenedText.strip().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, SectionKind> entry : LEADING_KEYWORDS.entrySet()) {
            if (normalized.startsWith(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
