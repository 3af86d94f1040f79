package ai.courseware.archiver.render;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps H1 for the document title by shifting section headings one level down, outside fenced code.
 */
class HeadingNormalizer {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})(\\s.*|$)");
    private static final Pattern FENCE = Pattern.compile("^\\s{0,3}(`{3,}|~{3,})");
    private static final int MAX_LEVEL = 6;

    String shiftHeadings(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        String openFence = null;
        for (String line : markdown.split("\n", -1)) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            Matcher fence = FENCE.matcher(line);
            if (fence.find()) {
                String marker = fence.group(1);
                if (openFence == null) {
                    openFence = marker;
                } else if (marker.charAt(0) == openFence.charAt(0) && marker.length() >= openFence.length()
                        && line.strip().length() == marker.length()) {
                    openFence = null;
                }
                builder.append(line);
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (openFence == null && heading.matches() && heading.group(1).length() < MAX_LEVEL) {
                builder.append('#').append(line);
            } else {
                builder.append(line);
            }
        }
        return builder.toString();
    }

    String formatTitle(String title) {
        String value = title == null ? "" : title.replaceAll("\\s+", " ").strip();
        return "# " + (value.isEmpty() ? "Untitled" : value);
    }
}
