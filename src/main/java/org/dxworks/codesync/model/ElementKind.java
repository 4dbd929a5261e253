package org.dxworks.codesync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ElementKind {
    PACKAGE("package"),
    CLASS("class"),
    INTERFACE("interface"),
    ENUM("enum"),
    ENUM_CONSTANT("enum_constant"),
    METHOD("method"),
    CONSTRUCTOR("constructor"),
    FIELD("field");

    private final String name;

    ElementKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public boolean isType() {
        return this == CLASS || this == INTERFACE || this == ENUM;
    }

    public boolean isMember() {
        return this == METHOD || this == CONSTRUCTOR || this == FIELD || this == ENUM_CONSTANT;
    }
}
