package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Maintainability {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    VERY_POOR;

    public static Maintainability fromScore(int score) {
        if (score <= 30) {
            return EXCELLENT;
        } else if (score <= 50) {
            return GOOD;
        } else if (score <= 70) {
            return FAIR;
        } else if (score <= 85) {
            return POOR;
        }
        return VERY_POOR;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
