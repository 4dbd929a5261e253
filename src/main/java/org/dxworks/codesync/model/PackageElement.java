package org.dxworks.codesync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class PackageElement extends Element {
    public static final String DEFAULT_PACKAGE = "default";

    public PackageElement(String name) {
        super(ElementKind.PACKAGE, name == null ? DEFAULT_PACKAGE : name);
    }

    @JsonIgnore
    public boolean isDefaultPackage() {
        return DEFAULT_PACKAGE.equals(name);
    }
}
