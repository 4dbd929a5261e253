package org.dxworks.codesync.model;

import java.util.ArrayList;
import java.util.List;

public class TypeElement extends Element {
    public String extendsType;
    public List<String> implementsInterfaces = new ArrayList<>();  // also holds the parents of an interface

    public TypeElement(ElementKind kind, String name) {
        super(kind, name);
        if (!kind.isType()) {
            throw new IllegalArgumentException("Not a type kind: " + kind);
        }
    }
}
