package org.carball.rlsguard.model.analysis;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PerformanceAnalysis {
    private PerformanceImpact impact;
    /** Estimated per-query overhead in percent, 0-200. */
    private int estimatedOverhead;
    @Builder.Default
    private List<PerformanceBottleneck> bottlenecks = List.of();
    @Builder.Default
    private List<OptimizationSuggestion> optimizations = List.of();
    @Builder.Default
    private List<IndexRequirement> indexRequirements = List.of();
}
