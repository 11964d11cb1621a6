package org.carball.rlsguard.model.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A policy as stored by Postgres: its name, the table it is attached to (optional), the
 * USING/WITH CHECK expression text, the command it applies to and its combination mode.
 */
public record PolicyDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("table") String table,
        @JsonProperty("expression") String expression,
        @JsonProperty("command") PolicyCommand command,
        @JsonProperty("type") PolicyMode type
) {

    public PolicyDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        if (type == null) {
            type = PolicyMode.PERMISSIVE;
        }
    }

    public static PolicyDefinition of(String name, String expression, PolicyCommand command, PolicyMode type) {
        return new PolicyDefinition(name, null, expression, command, type);
    }
}
