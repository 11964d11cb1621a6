package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VulnerabilityType {
    DATA_LEAK,
    PRIVILEGE_ESCALATION,
    INJECTION,
    BYPASS,
    TIMING_ATTACK;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
