package org.carball.rlsguard.model.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    CONTRADICTORY,
    REDUNDANT,
    AMBIGUOUS,
    ORDERING;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
