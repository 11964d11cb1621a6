package org.carball.rlsguard.analyzer;

import org.carball.rlsguard.model.analysis.BottleneckType;
import org.carball.rlsguard.model.analysis.ChangeRisk;
import org.carball.rlsguard.model.analysis.Effort;
import org.carball.rlsguard.model.analysis.ImpactLevel;
import org.carball.rlsguard.model.analysis.IndexRequirement;
import org.carball.rlsguard.model.analysis.IndexType;
import org.carball.rlsguard.model.analysis.OptimizationSuggestion;
import org.carball.rlsguard.model.analysis.PerformanceAnalysis;
import org.carball.rlsguard.model.analysis.PerformanceBottleneck;
import org.carball.rlsguard.model.analysis.PerformanceImpact;
import org.carball.rlsguard.model.ast.FunctionNode;
import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.model.ast.PolicyTrees;
import org.carball.rlsguard.model.policy.DependencyType;
import org.carball.rlsguard.model.policy.PolicyDependency;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class PerformanceAnalyzer {

    private static final int BASE_OVERHEAD_PERCENT = 5;
    private static final int OVERHEAD_PER_DEPENDENCY = 2;
    private static final int MAX_OVERHEAD_PERCENT = 200;
    private static final int IMPACT_PER_DEPENDENCY = 2;
    private static final int DEPENDENCY_IMPACT_CAP = 20;

    private static final Map<BottleneckType, OptimizationSuggestion> OPTIMIZATIONS = new EnumMap<>(BottleneckType.class);

    static {
        OPTIMIZATIONS.put(BottleneckType.SUBQUERY, new OptimizationSuggestion(
                "Consider rewriting subquery as JOIN",
                "Significant performance improvement for large datasets",
                Effort.MODERATE,
                ChangeRisk.LOW_RISK));
        OPTIMIZATIONS.put(BottleneckType.FUNCTION_CALL, new OptimizationSuggestion(
                "Cache function results if deterministic",
                "Reduced CPU overhead per row",
                Effort.LOW,
                ChangeRisk.SAFE));
    }

    public PerformanceAnalysis analyzePerformanceImpact(PolicyConditionNode ast, List<PolicyDependency> dependencies) {
        List<PerformanceBottleneck> bottlenecks = findFunctionBottlenecks(ast);
        List<IndexRequirement> indexRequirements = recommendIndexes(dependencies);

        List<OptimizationSuggestion> optimizations = new ArrayList<>();
        for (PerformanceBottleneck bottleneck : bottlenecks) {
            OptimizationSuggestion suggestion = OPTIMIZATIONS.get(bottleneck.type());
            if (suggestion != null) {
                optimizations.add(suggestion);
            }
        }

        return PerformanceAnalysis.builder()
                .impact(calculatePerformanceImpact(bottlenecks, dependencies.size()))
                .estimatedOverhead(estimatePerformanceOverhead(bottlenecks, dependencies.size()))
                .bottlenecks(List.copyOf(bottlenecks))
                .optimizations(List.copyOf(optimizations))
                .indexRequirements(List.copyOf(indexRequirements))
                .build();
    }

    /**
     * EXISTS and IN calls usually make the planner evaluate a subquery per row. The match is
     * case-sensitive so that names like {@code is_admin} are left alone.
     */
    private List<PerformanceBottleneck> findFunctionBottlenecks(PolicyConditionNode ast) {
        return PolicyTrees.fold(ast, new ArrayList<>(), (bottlenecks, node) -> {
            if (node instanceof FunctionNode function) {
                String name = function.functionName();
                if (name.contains("EXISTS") || name.contains("IN")) {
                    bottlenecks.add(new PerformanceBottleneck(
                            "Function: " + name,
                            BottleneckType.SUBQUERY,
                            ImpactLevel.HIGH,
                            name + " may require subquery execution"));
                }
            }
            return bottlenecks;
        });
    }

    private List<IndexRequirement> recommendIndexes(List<PolicyDependency> dependencies) {
        List<IndexRequirement> requirements = new ArrayList<>();
        for (PolicyDependency dependency : dependencies) {
            if (dependency.type() == DependencyType.COLUMN) {
                requirements.add(new IndexRequirement(
                        List.of(dependency.name()),
                        IndexType.BTREE,
                        ImpactLevel.MEDIUM,
                        "Column " + dependency.name() + " is used in RLS policy condition"));
            }
        }
        return requirements;
    }

    private PerformanceImpact calculatePerformanceImpact(List<PerformanceBottleneck> bottlenecks, int dependencyCount) {
        int score = 0;
        for (PerformanceBottleneck bottleneck : bottlenecks) {
            score += bottleneck.impact().getImpactWeight();
        }
        score += Math.min(dependencyCount * IMPACT_PER_DEPENDENCY, DEPENDENCY_IMPACT_CAP);

        return PerformanceImpact.fromScore(score);
    }

    private int estimatePerformanceOverhead(List<PerformanceBottleneck> bottlenecks, int dependencyCount) {
        int overhead = BASE_OVERHEAD_PERCENT;
        for (PerformanceBottleneck bottleneck : bottlenecks) {
            overhead += bottleneck.impact().getOverheadPercent();
        }
        overhead += dependencyCount * OVERHEAD_PER_DEPENDENCY;

        return Math.min(overhead, MAX_OVERHEAD_PERCENT);
    }
}
