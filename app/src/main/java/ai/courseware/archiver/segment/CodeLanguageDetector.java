package ai.courseware.archiver.segment;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;

/**
 * Guesses the language of a code block, first from highlighter class names and then from the code itself.
 */
public class CodeLanguageDetector {

    private static final Pattern CLASS_PATTERN = Pattern.compile("(?:^|\\s)(?:language|lang|highlight)-([A-Za-z0-9_+#-]+)");

    private static final Pattern C_INCLUDE = Pattern.compile("(?m)^\\s*#include\\s*[<\"]|\\bint\\s+main\\s*\\(");
    private static final Pattern JAVA = Pattern.compile("(?m)^\\s*import\\s+java[x]?\\.|\\bpublic\\s+(?:static\\s+void\\s+main|class)\\b");
    private static final Pattern PYTHON = Pattern.compile("(?m)^\\s*(?:from\\s+[\\w.]+\\s+import\\s|import\\s+[\\w.]+(?:\\s+as\\s+\\w+)?\\s*$|def\\s+\\w+\\s*\\(.*\\)\\s*:)");
    private static final Pattern JS_IMPORT = Pattern.compile("(?m)^\\s*import\\s+.+\\s+from\\s+['\"]|\\brequire\\s*\\(\\s*['\"]");
    private static final Pattern SQL = Pattern.compile("(?is)\\bselect\\b.+\\bfrom\\b|\\b(?:insert\\s+into|create\\s+table|delete\\s+from|update\\s+\\w+\\s+set)\\b");
    private static final Pattern JAVASCRIPT = Pattern.compile("(?m)^\\s*(?:const|let|var)\\s+\\w+\\s*=|\\bfunction\\s*\\w*\\s*\\(");
    private static final Pattern CLASS_SYNTAX = Pattern.compile("\\b(?:class|interface|enum)\\s+\\w+[^{;]*\\{");
    private static final Pattern SHELL_PROMPT = Pattern.compile("(?m)^\\s*(?:\\$|#)\\s+\\S");

    public Optional<String> detect(Element codeContainer) {
        if (codeContainer == null) {
            return Optional.empty();
        }
        Optional<String> fromClass = fromClassName(codeContainer.className());
        if (fromClass.isPresent()) {
            return fromClass;
        }
        Element code = codeContainer.selectFirst("code");
        if (code != null) {
            fromClass = fromClassName(code.className());
            if (fromClass.isPresent()) {
                return fromClass;
            }
        }
        return fromContent(codeContainer.wholeText());
    }

    Optional<String> fromClassName(String className) {
        if (className == null || className.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = CLASS_PATTERN.matcher(className);
        if (matcher.find()) {
            return Optional.of(matcher.group(1).toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    public Optional<String> fromContent(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String trimmed = code.strip();
        if (trimmed.startsWith("#!")) {
            return Optional.of(fromShebang(trimmed.lines().findFirst().orElse("")));
        }
        if (trimmed.contains("<?php")) {
            return Optional.of("php");
        }
        if (C_INCLUDE.matcher(trimmed).find()) {
            return Optional.of("c");
        }
        if (JAVA.matcher(trimmed).find()) {
            return Optional.of("java");
        }
        if (PYTHON.matcher(trimmed).find()) {
            return Optional.of("python");
        }
        if (JS_IMPORT.matcher(trimmed).find()) {
            return Optional.of("javascript");
        }
        if (SQL.matcher(trimmed).find()) {
            return Optional.of("sql");
        }
        if (JAVASCRIPT.matcher(trimmed).find()) {
            return Optional.of("javascript");
        }
        if (SHELL_PROMPT.matcher(trimmed).find()) {
            return Optional.of("bash");
        }
        if (isBraceHeavy(trimmed) && CLASS_SYNTAX.matcher(trimmed).find()) {
            return Optional.of("java");
        }
        return Optional.empty();
    }

    private String fromShebang(String shebang) {
        String line = shebang.toLowerCase(Locale.ROOT);
        if (line.contains("python")) {
            return "python";
        }
        if (line.contains("node")) {
            return "javascript";
        }
        if (line.contains("perl")) {
            return "perl";
        }
        if (line.contains("ruby")) {
            return "ruby";
        }
        if (line.endsWith("/sh") || line.endsWith(" sh")) {
            return "sh";
        }
        return "bash";
    }

    private boolean isBraceHeavy(String code) {
        long braces = code.chars().filter(ch -> ch == '{' || ch == '}').count();
        long statements = code.chars().filter(ch -> ch == ';').count();
        return braces >= 4 && statements >= 2;
    }
}
