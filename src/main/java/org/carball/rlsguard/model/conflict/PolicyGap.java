package org.carball.rlsguard.model.conflict;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.rlsguard.model.analysis.Severity;

public record PolicyGap(
        String scenario,
        Severity severity,
        String description,
        @JsonProperty("suggested_policy") String suggestedPolicy
) {
}
