package org.carball.rlsguard.model.policy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExpressionType {
    SIMPLE,
    COMPLEX,
    COMPOUND,
    SUBQUERY,
    FUNCTION_CALL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
