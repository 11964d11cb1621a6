package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InjectionType {
    SQL_INJECTION,
    PARAMETER_INJECTION,
    FUNCTION_INJECTION;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
