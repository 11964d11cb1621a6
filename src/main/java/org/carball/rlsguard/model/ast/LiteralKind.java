package org.carball.rlsguard.model.ast;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LiteralKind {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    LIST;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
