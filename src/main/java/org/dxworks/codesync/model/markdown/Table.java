package org.dxworks.codesync.model.markdown;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cell matrix of a pipe table. Row 0 is the header; the separator row is not stored.
 */
public class Table {
    private final List<List<String>> rows = new ArrayList<>();

    public Table(List<List<String>> rows) {
        for (List<String> row : rows) {
            this.rows.add(List.copyOf(row));
        }
    }

    public List<List<String>> rows() {
        return Collections.unmodifiableList(rows);
    }

    public List<String> header() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }

    public List<List<String>> body() {
        return rows.size() <= 1 ? List.of() : Collections.unmodifiableList(rows.subList(1, rows.size()));
    }

    public Table withBody(List<List<String>> newBody) {
        List<List<String>> all = new ArrayList<>();
        all.add(header());
        all.addAll(newBody);
        return new Table(all);
    }

    public Table withAppendedRows(List<List<String>> extraRows) {
        List<List<String>> all = new ArrayList<>(rows);
        all.addAll(extraRows);
        return new Table(all);
    }

    /**
     * Renders header, a regenerated separator row and the body, one line per row.
     */
    public List<String> render(String separatorCell) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            lines.add(renderRow(rows.get(i)));
            if (i == 0) {
                lines.add(renderRow(Collections.nCopies(Math.max(1, header().size()), separatorCell)));
            }
        }
        return lines;
    }

    private static String renderRow(List<String> cells) {
        return "| " + String.join(" | ", cells) + " |";
    }
}
