package org.carball.rlsguard.model.analysis;

import java.util.List;

/**
 * Score is 1-100; level, maintainability and testability are step functions of it.
 */
public record PolicyComplexity(
        int score,
        ComplexityLevel level,
        List<ComplexityFactor> factors,
        Maintainability maintainability,
        Testability testability
) {

    public PolicyComplexity {
        factors = List.copyOf(factors);
    }
}
