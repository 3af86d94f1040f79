package ai.courseware.archiver.render;

import ai.courseware.archiver.segment.CodeLanguageDetector;
import java.util.Optional;
import org.jsoup.nodes.Element;

/**
 * Formats preformatted code as fenced markdown blocks.
 */
class CodeBlockFormatter {

    private static final String DEFAULT_FENCE = "```";

    private final CodeLanguageDetector languageDetector;

    CodeBlockFormatter(CodeLanguageDetector languageDetector) {
        this.languageDetector = languageDetector;
    }

    String fence(String code, Optional<String> language) {
        String body = stripTrailingNewlines(code == null ? "" : code);
        int longestRun = longestBacktickRun(body);
        String fence = longestRun >= DEFAULT_FENCE.length() ? "`".repeat(longestRun + 1) : DEFAULT_FENCE;
        return fence + language.orElse("") + "\n" + body + "\n" + fence;
    }

    Optional<String> languageOf(Element pre) {
        return languageDetector.detect(pre);
    }

    static int longestBacktickRun(String value) {
        int longest = 0;
        int current = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '`') {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }

    private static String stripTrailingNewlines(String value) {
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == '\n' || value.charAt(end - 1) == '\r')) {
            end--;
        }
        return value.substring(0, end);
    }
}
