package ai.courseware.archiver.render;

import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;

/**
 * Converts HTML tables to pipe tables. The separator row follows the first row's cell count.
 */
class TableFormatter {

    String format(Element table, MarkdownConverter converter, RenderContext context) {
        List<List<String>> rows = new ArrayList<>();
        for (Element row : table.select("tr")) {
            if (row.closest("table") != table) {
                continue;
            }
            List<String> cells = new ArrayList<>();
            for (Element cell : row.children()) {
                String tag = cell.normalName();
                if ("td".equals(tag) || "th".equals(tag)) {
                    cells.add(cellText(converter.inlineChildren(cell, context)));
                }
            }
            rows.add(cells);
        }
        if (rows.isEmpty()) {
            throw new RenderException("Table has no rows");
        }

        StringBuilder builder = new StringBuilder();
        List<String> header = rows.get(0);
        appendRow(builder, header);
        builder.append('\n');
        List<String> separator = new ArrayList<>();
        for (int i = 0; i < Math.max(1, header.size()); i++) {
            separator.add("---");
        }
        appendRow(builder, separator);
        for (int i = 1; i < rows.size(); i++) {
            builder.append('\n');
            appendRow(builder, rows.get(i));
        }
        return builder.toString();
    }

    private static void appendRow(StringBuilder builder, List<String> cells) {
        builder.append('|');
        if (cells.isEmpty()) {
            builder.append("  |");
        }
        for (String cell : cells) {
            builder.append(' ').append(cell).append(" |");
        }
    }

    private static String cellText(String raw) {
        return raw.replaceAll("\\s+", " ").strip().replace("|", "\\|");
    }
}
