package org.carball.rlsguard.model.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RedundancyLevel {
    COMPLETE,
    PARTIAL,
    MINIMAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
