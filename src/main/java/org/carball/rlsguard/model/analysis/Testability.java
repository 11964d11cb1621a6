package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Testability {
    EASY,
    MODERATE,
    DIFFICULT,
    VERY_DIFFICULT;

    public static Testability fromScore(int score) {
        if (score <= 20) {
            return EASY;
        } else if (score <= 40) {
            return MODERATE;
        } else if (score <= 70) {
            return DIFFICULT;
        }
        return VERY_DIFFICULT;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
