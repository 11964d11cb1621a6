package org.carball.rlsguard.model.policy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DependencyType {
    TABLE,
    COLUMN,
    FUNCTION,
    ROLE,
    SESSION_VARIABLE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
