package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SecurityStrength {
    VERY_WEAK(0),
    WEAK(20),
    MODERATE(40),
    STRONG(60),
    VERY_STRONG(75),
    EXCELLENT(90);

    private final int minScore;

    SecurityStrength(int minScore) {
        this.minScore = minScore;
    }

    public static SecurityStrength fromScore(int score) {
        SecurityStrength result = VERY_WEAK;
        for (SecurityStrength strength : values()) {
            if (score >= strength.minScore) {
                result = strength;
            }
        }
        return result;
    }

    public boolean isAtLeast(SecurityStrength other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
