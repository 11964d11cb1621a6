package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskImpact {
    MINIMAL,
    LOW,
    MODERATE,
    HIGH,
    SEVERE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
