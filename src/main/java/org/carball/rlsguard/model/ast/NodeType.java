package org.carball.rlsguard.model.ast;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeType {
    COMPARISON("comparison"),
    LOGICAL("logical"),
    FUNCTION("function"),
    COLUMN("column"),
    LITERAL("literal"),
    SUBQUERY("subquery");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
