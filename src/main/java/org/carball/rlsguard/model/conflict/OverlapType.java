package org.carball.rlsguard.model.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OverlapType {
    IDENTICAL,
    SUBSET,
    INTERSECTION;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
