package org.carball.rlsguard.model.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.carball.rlsguard.model.analysis.PolicyIssue;

import java.util.List;

/**
 * One policy of a set with its analysis. {@code parsed} is null when the policy has no
 * expression to analyze.
 */
public record AnalyzedPolicy(
        String name,
        String table,
        PolicyCommand command,
        PolicyMode type,
        ParsedPolicyCondition parsed,
        List<PolicyIssue> issues
) {

    public AnalyzedPolicy {
        issues = List.copyOf(issues);
    }

    @JsonIgnore
    public boolean isAnalyzed() {
        return parsed != null;
    }
}
