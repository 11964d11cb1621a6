package org.carball.rlsguard.model.analysis;

public record SecurityRecommendation(
        RecommendationPriority priority,
        String recommendation,
        String rationale,
        String implementation,
        RecommendationImpact impact
) {
}
