package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Effort {
    MINIMAL,
    LOW,
    MODERATE,
    HIGH;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
