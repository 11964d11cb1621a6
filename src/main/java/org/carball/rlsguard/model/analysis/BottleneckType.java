package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BottleneckType {
    SEQUENTIAL_SCAN,
    NESTED_LOOP,
    SUBQUERY,
    FUNCTION_CALL,
    JOIN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
