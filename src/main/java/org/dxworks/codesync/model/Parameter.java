package org.dxworks.codesync.model;

public class Parameter {
    public String name;
    public String type;

    public Parameter() {
    }

    public Parameter(String name, String type) {
        this.name = name;
        this.type = type;
    }
}
