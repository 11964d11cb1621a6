package org.carball.rlsguard.model.policy;

import lombok.Builder;
import lombok.Data;
import org.carball.rlsguard.model.analysis.PerformanceAnalysis;
import org.carball.rlsguard.model.analysis.PolicyComplexity;
import org.carball.rlsguard.model.analysis.SecurityAnalysis;
import org.carball.rlsguard.model.ast.PolicyConditionNode;

import java.util.List;

/**
 * Everything known about one policy expression. {@code conditions} holds the root of the
 * parsed tree, or nothing when {@code fallback} is set because the expression did not parse.
 */
@Data
@Builder
public class ParsedPolicyCondition {
    private ExpressionType type;
    private String expression;
    @Builder.Default
    private List<PolicyConditionNode> conditions = List.of();
    @Builder.Default
    private List<PolicyDependency> dependencies = List.of();
    private PolicyComplexity complexity;
    private SecurityAnalysis security;
    private PerformanceAnalysis performance;
    private boolean fallback;

    public PolicyConditionNode root() {
        return conditions.isEmpty() ? null : conditions.get(0);
    }
}
