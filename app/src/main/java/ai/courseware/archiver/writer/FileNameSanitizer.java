package ai.courseware.archiver.writer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns page titles into file-system safe base names.
 */
public final class FileNameSanitizer {

    static final int MAX_LENGTH = 200;
    static final String FALLBACK = "untitled";

    private static final Pattern RESERVED = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPEATED_UNDERSCORE = Pattern.compile("_{2,}");

    private FileNameSanitizer() {
    }

    public static String sanitize(String title) {
        if (title == null) {
            return FALLBACK;
        }
        String name = RESERVED.matcher(title.strip()).replaceAll("_");
        name = name.replace("..", "_");
        if (name.startsWith(".")) {
            name = "_" + name.substring(1);
        }
        name = WHITESPACE.matcher(name).replaceAll("_");
        name = REPEATED_UNDERSCORE.matcher(name).replaceAll("_");
        if (name.length() > MAX_LENGTH) {
            name = name.substring(0, MAX_LENGTH);
        }
        name = name.toLowerCase(Locale.ROOT);
        if (name.isEmpty() || name.chars().allMatch(ch -> ch == '_')) {
            return FALLBACK;
        }
        return name;
    }
}
