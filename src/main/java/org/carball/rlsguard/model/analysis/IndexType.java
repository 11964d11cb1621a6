package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IndexType {
    BTREE,
    HASH,
    GIN,
    GIST,
    SPGIST,
    BRIN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
