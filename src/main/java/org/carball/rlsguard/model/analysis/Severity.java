package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    CRITICAL(40),
    HIGH(20),
    MEDIUM(10),
    LOW(5),
    INFO(0);

    private final int scorePenalty;

    Severity(int scorePenalty) {
        this.scorePenalty = scorePenalty;
    }

    /**
     * Points a finding of this severity takes off the security score.
     */
    public int getScorePenalty() {
        return scorePenalty;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
