package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationPriority {
    IMMEDIATE,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
