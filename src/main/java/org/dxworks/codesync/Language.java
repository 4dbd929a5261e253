package org.dxworks.codesync;

public enum Language {
    JAVA("java"),
    MARKDOWN("markdown");

    private final String name;

    Language(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
