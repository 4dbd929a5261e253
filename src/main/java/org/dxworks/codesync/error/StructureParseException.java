package org.dxworks.codesync.error;

public class StructureParseException extends StructureException {
    private final int line;
    private final int column;

    public StructureParseException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    /** 1-based line of the first syntax error. */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
