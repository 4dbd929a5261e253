package org.dxworks.codesync.change;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeType {
    ADD_FEATURE("add_feature"),
    MODIFY_FEATURE("modify_feature"),
    FIX_BUG("fix_bug"),
    REFACTOR("refactor"),
    OPTIMIZE("optimize"),
    OTHER("other");

    private final String value;

    ChangeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Unknown or missing values are read as {@link #OTHER}. */
    @JsonCreator
    public static ChangeType fromValue(String value) {
        if (value != null) {
            for (ChangeType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        return OTHER;
    }
}
