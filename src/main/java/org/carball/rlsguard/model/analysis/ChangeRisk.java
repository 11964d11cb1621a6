package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeRisk {
    SAFE,
    LOW_RISK,
    MODERATE_RISK,
    HIGH_RISK;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
