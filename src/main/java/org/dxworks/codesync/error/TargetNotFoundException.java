package org.dxworks.codesync.error;

public class TargetNotFoundException extends StructureException {
    private final String selector;

    public TargetNotFoundException(String what, String selector) {
        super(what + " not found: " + selector);
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }
}
