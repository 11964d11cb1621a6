package org.carball.rlsguard.analyzer;

import org.carball.rlsguard.model.analysis.ComplexityFactor;
import org.carball.rlsguard.model.analysis.ComplexityLevel;
import org.carball.rlsguard.model.analysis.Maintainability;
import org.carball.rlsguard.model.analysis.PolicyComplexity;
import org.carball.rlsguard.model.analysis.Testability;
import org.carball.rlsguard.model.ast.NodeType;
import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.model.ast.PolicyTrees;
import org.carball.rlsguard.model.policy.PolicyDependency;

import java.util.ArrayList;
import java.util.List;

public class ComplexityScorer {

    private static final int DEPTH_WEIGHT = 5;
    private static final int DEPTH_CAP = 30;
    private static final int DEPENDENCY_WEIGHT = 3;
    private static final int DEPENDENCY_CAP = 20;
    private static final int LOGICAL_OPERATOR_WEIGHT = 2;
    private static final int LOGICAL_OPERATOR_CAP = 15;
    private static final int FUNCTION_CALL_WEIGHT = 4;
    private static final int FUNCTION_CALL_CAP = 20;
    private static final int MAX_SCORE = 100;

    public PolicyComplexity calculateComplexity(PolicyConditionNode ast, List<PolicyDependency> dependencies) {
        List<ComplexityFactor> factors = new ArrayList<>();
        int complexity = 0;

        // Factor 1: Nesting depth of the tree
        int depth = PolicyTrees.depth(ast);
        int depthScore = Math.min(depth * DEPTH_WEIGHT, DEPTH_CAP);
        complexity += depthScore;
        factors.add(new ComplexityFactor("AST Depth", depthScore,
                "Expression has " + depth + " levels of nesting"));

        // Factor 2: External elements the policy depends on
        int dependencyScore = Math.min(dependencies.size() * DEPENDENCY_WEIGHT, DEPENDENCY_CAP);
        complexity += dependencyScore;
        factors.add(new ComplexityFactor("Dependencies", dependencyScore,
                "Policy depends on " + dependencies.size() + " external elements"));

        // Factor 3: AND/OR/NOT operators
        int logicalCount = PolicyTrees.count(ast, NodeType.LOGICAL);
        int logicalScore = Math.min(logicalCount * LOGICAL_OPERATOR_WEIGHT, LOGICAL_OPERATOR_CAP);
        complexity += logicalScore;
        factors.add(new ComplexityFactor("Logical Operators", logicalScore,
                "Contains " + logicalCount + " logical operators (AND/OR/NOT)"));

        // Factor 4: Function calls
        int functionCount = PolicyTrees.count(ast, NodeType.FUNCTION);
        int functionScore = Math.min(functionCount * FUNCTION_CALL_WEIGHT, FUNCTION_CALL_CAP);
        complexity += functionScore;
        factors.add(new ComplexityFactor("Function Calls", functionScore,
                "Contains " + functionCount + " function calls"));

        int score = Math.min(complexity, MAX_SCORE);
        return new PolicyComplexity(
                score,
                ComplexityLevel.fromScore(score),
                factors,
                Maintainability.fromScore(score),
                Testability.fromScore(score));
    }

    public String generateComplexityReport(String policyName, PolicyComplexity complexity) {
        StringBuilder report = new StringBuilder();

        report.append("Policy: ").append(policyName).append("\n");
        report.append("Complexity: ").append(complexity.level()).append(" (").append(complexity.score()).append("/100)\n");
        report.append("Maintainability: ").append(complexity.maintainability()).append("\n");
        report.append("Testability: ").append(complexity.testability()).append("\n");
        report.append("Factors:\n");

        for (ComplexityFactor factor : complexity.factors()) {
            report.append("  - ").append(factor.factor()).append(": ").append(factor.impact())
                    .append(" (").append(factor.description()).append(")\n");
        }

        return report.toString();
    }
}
