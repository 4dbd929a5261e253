package org.dxworks.codesync.mutation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MemberKind {
    @JsonProperty("method")
    METHOD,
    @JsonProperty("constructor")
    CONSTRUCTOR,
    @JsonProperty("field")
    FIELD,
    @JsonProperty("type")
    TYPE
}
