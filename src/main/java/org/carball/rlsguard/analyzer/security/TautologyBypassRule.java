package org.carball.rlsguard.analyzer.security;

import org.carball.rlsguard.model.analysis.BypassRisk;
import org.carball.rlsguard.model.analysis.Likelihood;
import org.carball.rlsguard.model.analysis.RiskImpact;
import org.carball.rlsguard.model.ast.ComparisonNode;
import org.carball.rlsguard.model.ast.ComparisonOperator;
import org.carball.rlsguard.model.ast.LiteralNode;
import org.carball.rlsguard.model.ast.LogicalNode;
import org.carball.rlsguard.model.ast.LogicalOperator;
import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.model.ast.PolicyTrees;

import java.util.Objects;

/**
 * {@code ... OR true} and {@code ... OR 1=1} make the whole policy pass. Found in the text
 * as written and, regardless of case and spacing, as an OR operand in the tree.
 */
public class TautologyBypassRule implements SecurityRule {

    @Override
    public String name() {
        return "TAUTOLOGY_BYPASS";
    }

    @Override
    public void evaluate(PolicyConditionNode ast, String expression, SecurityFindings findings) {
        boolean inText = expression.contains("OR true") || expression.contains("OR 1=1");
        if (!inText && !PolicyTrees.anyMatch(ast, TautologyBypassRule::isOrWithTautology)) {
            return;
        }

        findings.addBypassRisk(new BypassRisk(
                "Logical bypass",
                Likelihood.VERY_HIGH,
                RiskImpact.SEVERE,
                "Policy contains logical conditions that always evaluate to true",
                "Remove or fix logical conditions that bypass security checks"));
    }

    private static boolean isOrWithTautology(PolicyConditionNode node) {
        return node instanceof LogicalNode logical
                && logical.operator() == LogicalOperator.OR
                && (isTautology(logical.left()) || isTautology(logical.right()));
    }

    private static boolean isTautology(PolicyConditionNode node) {
        if (node instanceof LiteralNode literal) {
            return literal.isTrue();
        }
        return node instanceof ComparisonNode comparison
                && comparison.operator() == ComparisonOperator.EQUALS
                && comparison.left() instanceof LiteralNode left
                && comparison.right() instanceof LiteralNode right
                && Objects.equals(left.value(), right.value());
    }
}
