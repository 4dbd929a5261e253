package org.dxworks.codesync.analyzer.markdown;

import org.dxworks.codesync.model.SourceLines;
import org.dxworks.codesync.model.markdown.Table;
import org.dxworks.codesync.model.markdown.TableBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds pipe tables in a block of Markdown text. A table is a maximal run of at least two lines that start and end
 * with {@code |}; its second line is dropped when it is a {@code | --- |} separator. Escaped pipes inside cells are
 * not recognized.
 */
public class TableExtractor {
    private static final Pattern TABLE_LINE = Pattern.compile("^\\s*\\|.*\\|\\s*$");
    private static final Pattern SEPARATOR_LINE = Pattern.compile("^\\s*\\|[\\s\\-:|]*\\|\\s*$");

    public List<TableBlock> extract(String content) {
        List<String> lines = SourceLines.of(content).lines();
        List<TableBlock> tables = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            if (!isTableLine(lines.get(i))) {
                i++;
                continue;
            }
            int first = i;
            while (i < lines.size() && isTableLine(lines.get(i))) {
                i++;
            }
            int last = i - 1;
            if (last > first) {
                tables.add(new TableBlock(readTable(lines.subList(first, last + 1)), first, last));
            }
        }
        return tables;
    }

    public static boolean isTableLine(String line) {
        return TABLE_LINE.matcher(line).matches();
    }

    private Table readTable(List<String> tableLines) {
        List<List<String>> rows = new ArrayList<>();
        for (int j = 0; j < tableLines.size(); j++) {
            String line = tableLines.get(j);
            if (j == 1 && SEPARATOR_LINE.matcher(line).matches()) {
                continue;
            }
            rows.add(splitCells(line));
        }
        return new Table(rows);
    }

    static List<String> splitCells(String line) {
        String[] parts = line.trim().split("(?<!\\\\)\\|", -1);
        List<String> cells = new ArrayList<>();
        // parts[0] and parts[last] are the empty fields outside the outer pipes
        for (int k = 1; k < parts.length - 1; k++) {
            cells.add(parts[k].trim());
        }
        return cells;
    }
}
