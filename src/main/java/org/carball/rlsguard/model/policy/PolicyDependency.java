package org.carball.rlsguard.model.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PolicyDependency(
        DependencyType type,
        String name,
        boolean required,
        String description,
        @JsonProperty("security_implications") List<String> securityImplications
) {

    public PolicyDependency {
        securityImplications = List.copyOf(securityImplications);
    }
}
