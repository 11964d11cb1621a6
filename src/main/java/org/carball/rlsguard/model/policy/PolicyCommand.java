package org.carball.rlsguard.model.policy;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum PolicyCommand {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    ALL;

    /**
     * Whether a policy for this command and one for {@code other} act on the same
     * statements.
     */
    public boolean overlaps(PolicyCommand other) {
        return this == other || this == ALL || other == ALL;
    }

    @JsonCreator
    public static PolicyCommand fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Policy command must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown policy command: " + value, e);
        }
    }
}
