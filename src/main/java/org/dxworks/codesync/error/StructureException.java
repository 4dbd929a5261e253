package org.dxworks.codesync.error;

/**
 * Base type of every failure raised by the structural parsers and editors.
 * Editors never return partially edited text: when one of these is thrown the caller still holds the original.
 */
public abstract class StructureException extends RuntimeException {

    protected StructureException(String message) {
        super(message);
    }
}
