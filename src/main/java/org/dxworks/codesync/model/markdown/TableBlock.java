package org.dxworks.codesync.model.markdown;

/**
 * A table found in section content, with its 0-based line range {@code [firstLine, lastLine]} inside that content.
 */
public class TableBlock {
    public final Table table;
    public final int firstLine;
    public final int lastLine;

    public TableBlock(Table table, int firstLine, int lastLine) {
        this.table = table;
        this.firstLine = firstLine;
        this.lastLine = lastLine;
    }
}
