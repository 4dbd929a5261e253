package org.dxworks.codesync.model;

import java.util.ArrayList;
import java.util.List;

public class MethodElement extends Element {
    public String returnType;  // null for constructors
    public List<Parameter> parameters = new ArrayList<>();
    public boolean hasBody;

    public MethodElement(ElementKind kind, String name) {
        super(kind, name);
        if (kind != ElementKind.METHOD && kind != ElementKind.CONSTRUCTOR) {
            throw new IllegalArgumentException("Not a method kind: " + kind);
        }
    }
}
