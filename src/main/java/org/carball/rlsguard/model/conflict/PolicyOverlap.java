package org.carball.rlsguard.model.conflict;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PolicyOverlap(
        List<String> policies,
        @JsonProperty("overlap_type") OverlapType overlapType,
        @JsonProperty("redundancy_level") RedundancyLevel redundancyLevel,
        String recommendation
) {

    public PolicyOverlap {
        policies = List.copyOf(policies);
    }
}
