package org.carball.rlsguard.model.analysis;

public record PerformanceBottleneck(
        String location,
        BottleneckType type,
        ImpactLevel impact,
        String description
) {
}
