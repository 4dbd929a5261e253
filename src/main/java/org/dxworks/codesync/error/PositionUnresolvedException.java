package org.dxworks.codesync.error;

/**
 * A span needed by an edit could not be determined, typically because the braces after a declaration never balance.
 */
public class PositionUnresolvedException extends StructureException {

    public PositionUnresolvedException(String message) {
        super(message);
    }
}
