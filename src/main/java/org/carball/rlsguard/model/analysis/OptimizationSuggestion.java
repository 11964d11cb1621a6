package org.carball.rlsguard.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OptimizationSuggestion(
        String suggestion,
        @JsonProperty("potential_improvement") String potentialImprovement,
        Effort effort,
        ChangeRisk risk
) {
}
