package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationImpact {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
