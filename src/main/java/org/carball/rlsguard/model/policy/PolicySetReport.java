package org.carball.rlsguard.model.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import org.carball.rlsguard.model.analysis.ComplexityLevel;
import org.carball.rlsguard.model.analysis.PerformanceImpact;
import org.carball.rlsguard.model.analysis.SecurityStrength;
import org.carball.rlsguard.model.conflict.PolicyConflictReport;

import java.util.List;
import java.util.Map;

/**
 * Result of analyzing a whole set of policies. The distributions count analyzed policies
 * only; policies without an expression appear in {@code policies} but not in the tallies.
 */
@Data
@Builder
public class PolicySetReport {
    @JsonProperty("total_policies")
    private int totalPolicies;
    @JsonProperty("analyzed_policies")
    private int analyzedPolicies;
    @Builder.Default
    private List<AnalyzedPolicy> policies = List.of();
    @JsonProperty("complexity_distribution")
    private Map<ComplexityLevel, Integer> complexityDistribution;
    @JsonProperty("security_distribution")
    private Map<SecurityStrength, Integer> securityDistribution;
    @JsonProperty("performance_distribution")
    private Map<PerformanceImpact, Integer> performanceDistribution;
    @JsonProperty("conflict_report")
    private PolicyConflictReport conflictReport;

    @JsonIgnore
    public int issueCount() {
        return policies.stream().mapToInt(policy -> policy.issues().size()).sum();
    }
}
