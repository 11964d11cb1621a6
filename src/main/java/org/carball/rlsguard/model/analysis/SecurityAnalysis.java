package org.carball.rlsguard.model.analysis;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SecurityAnalysis {
    private SecurityStrength strength;
    private int score;
    @Builder.Default
    private List<SecurityVulnerability> vulnerabilities = List.of();
    @Builder.Default
    private List<BypassRisk> bypassRisks = List.of();
    @Builder.Default
    private List<InjectionRisk> injectionRisks = List.of();
    @Builder.Default
    private List<SecurityRecommendation> recommendations = List.of();
}
