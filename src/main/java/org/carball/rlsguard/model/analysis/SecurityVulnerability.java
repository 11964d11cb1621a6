package org.carball.rlsguard.model.analysis;

import lombok.Builder;

@Builder
public record SecurityVulnerability(
        String id,
        Severity severity,
        VulnerabilityType type,
        String description,
        String example,
        String mitigation,
        String cwe
) {
}
