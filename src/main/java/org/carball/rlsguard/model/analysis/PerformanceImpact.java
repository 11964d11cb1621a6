package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PerformanceImpact {
    NEGLIGIBLE(0),
    MINIMAL(5),
    LOW(10),
    MODERATE(20),
    HIGH(40),
    SEVERE(60);

    private final int minScore;

    PerformanceImpact(int minScore) {
        this.minScore = minScore;
    }

    public static PerformanceImpact fromScore(int score) {
        PerformanceImpact result = NEGLIGIBLE;
        for (PerformanceImpact impact : values()) {
            if (score >= impact.minScore) {
                result = impact;
            }
        }
        return result;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
