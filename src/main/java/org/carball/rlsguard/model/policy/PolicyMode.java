package org.carball.rlsguard.model.policy;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * How Postgres combines a policy with the others on its table: PERMISSIVE policies are
 * OR-ed together, RESTRICTIVE ones are AND-ed onto the result.
 */
public enum PolicyMode {
    PERMISSIVE,
    RESTRICTIVE;

    @JsonCreator
    public static PolicyMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return PERMISSIVE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown policy type: " + value, e);
        }
    }
}
