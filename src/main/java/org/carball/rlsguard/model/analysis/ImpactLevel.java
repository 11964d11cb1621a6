package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Four-step scale shared by bottleneck impact and index priority.
 */
public enum ImpactLevel {
    LOW(5, 5),
    MEDIUM(10, 10),
    HIGH(20, 25),
    CRITICAL(40, 50);

    private final int impactWeight;
    private final int overheadPercent;

    ImpactLevel(int impactWeight, int overheadPercent) {
        this.impactWeight = impactWeight;
        this.overheadPercent = overheadPercent;
    }

    public int getImpactWeight() {
        return impactWeight;
    }

    public int getOverheadPercent() {
        return overheadPercent;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
