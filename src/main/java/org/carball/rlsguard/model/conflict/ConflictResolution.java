package org.carball.rlsguard.model.conflict;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConflictResolution(
        @JsonProperty("conflict_id") String conflictId,
        ResolutionStrategy strategy,
        String implementation,
        @JsonProperty("risk_assessment") String riskAssessment
) {
}
