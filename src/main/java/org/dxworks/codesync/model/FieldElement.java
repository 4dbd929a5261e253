package org.dxworks.codesync.model;

public class FieldElement extends Element {
    public String type;

    public FieldElement(String name, String type) {
        super(ElementKind.FIELD, name);
        this.type = type;
    }
}
