package org.dxworks.codesync.model;

public class EnumConstantElement extends Element {

    public EnumConstantElement(String name) {
        super(ElementKind.ENUM_CONSTANT, name);
    }
}
