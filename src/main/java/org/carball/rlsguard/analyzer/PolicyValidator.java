package org.carball.rlsguard.analyzer;

import org.carball.rlsguard.model.analysis.ComplexityLevel;
import org.carball.rlsguard.model.analysis.ImpactLevel;
import org.carball.rlsguard.model.analysis.PerformanceBottleneck;
import org.carball.rlsguard.model.analysis.PolicyComplexity;
import org.carball.rlsguard.model.analysis.PolicyIssue;
import org.carball.rlsguard.model.analysis.SecurityVulnerability;
import org.carball.rlsguard.model.analysis.Severity;
import org.carball.rlsguard.model.ast.LiteralNode;
import org.carball.rlsguard.model.ast.LogicalNode;
import org.carball.rlsguard.model.ast.LogicalOperator;
import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.model.ast.PolicyTrees;
import org.carball.rlsguard.model.policy.ParsedPolicyCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the findings of an analysis into a flat list of issues a reviewer can act on, and
 * adds a few structural checks of its own.
 */
public class PolicyValidator {

    public List<PolicyIssue> validatePolicyLogic(ParsedPolicyCondition parsed) {
        List<PolicyIssue> issues = new ArrayList<>();

        for (SecurityVulnerability vulnerability : parsed.getSecurity().getVulnerabilities()) {
            issues.add(new PolicyIssue(vulnerability.severity(), vulnerability.description(), vulnerability.mitigation()));
        }

        for (PerformanceBottleneck bottleneck : parsed.getPerformance().getBottlenecks()) {
            if (bottleneck.impact() == ImpactLevel.CRITICAL || bottleneck.impact() == ImpactLevel.HIGH) {
                issues.add(new PolicyIssue(
                        bottleneck.impact() == ImpactLevel.CRITICAL ? Severity.HIGH : Severity.MEDIUM,
                        "Performance bottleneck: " + bottleneck.description(),
                        "Optimize " + bottleneck.location() + " to improve performance"));
            }
        }

        PolicyComplexity complexity = parsed.getComplexity();
        if (complexity.level() == ComplexityLevel.VERY_COMPLEX || complexity.level() == ComplexityLevel.EXTREME) {
            issues.add(new PolicyIssue(
                    Severity.MEDIUM,
                    "Policy is very complex (" + complexity.score() + "/100) and may be difficult to maintain",
                    "Consider breaking down into simpler policies or adding documentation"));
        }

        PolicyConditionNode root = parsed.root();
        if (root instanceof LiteralNode literal && literal.isTrue()) {
            issues.add(new PolicyIssue(
                    Severity.HIGH,
                    "Policy contains always-true condition",
                    "Replace with appropriate access control logic"));
        }

        if (PolicyTrees.anyMatch(root, PolicyValidator::isSelfContradiction)) {
            issues.add(new PolicyIssue(
                    Severity.MEDIUM,
                    "Policy may contain contradictory conditions",
                    "Review logical structure for consistency"));
        }

        return issues;
    }

    /**
     * {@code A AND NOT A}, in either order.
     */
    private static boolean isSelfContradiction(PolicyConditionNode node) {
        if (!(node instanceof LogicalNode logical) || logical.operator() != LogicalOperator.AND) {
            return false;
        }
        return negates(logical.left(), logical.right()) || negates(logical.right(), logical.left());
    }

    private static boolean negates(PolicyConditionNode candidate, PolicyConditionNode operand) {
        return candidate instanceof LogicalNode not
                && not.operator() == LogicalOperator.NOT
                && operand != null
                && operand.equals(not.right());
    }
}
