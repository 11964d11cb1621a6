package org.carball.rlsguard.model.analysis;

public record BypassRisk(
        String method,
        Likelihood likelihood,
        RiskImpact impact,
        String description,
        String prevention
) {
}
