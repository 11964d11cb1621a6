package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplexityLevel {
    TRIVIAL(0, 10),
    SIMPLE(11, 25),
    MODERATE(26, 50),
    COMPLEX(51, 75),
    VERY_COMPLEX(76, 90),
    EXTREME(91, 100);

    private final int minScore;
    private final int maxScore;

    ComplexityLevel(int minScore, int maxScore) {
        this.minScore = minScore;
        this.maxScore = maxScore;
    }

    public static ComplexityLevel fromScore(int score) {
        for (ComplexityLevel level : values()) {
            if (score <= level.maxScore) {
                return level;
            }
        }
        return EXTREME;
    }

    public int getMinScore() {
        return minScore;
    }

    public int getMaxScore() {
        return maxScore;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
