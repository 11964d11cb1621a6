package org.carball.rlsguard.model.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResolutionStrategy {
    MERGE,
    PRIORITIZE,
    SEPARATE,
    REFACTOR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
