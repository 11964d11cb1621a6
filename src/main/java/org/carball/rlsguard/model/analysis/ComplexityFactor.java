package org.carball.rlsguard.model.analysis;

public record ComplexityFactor(String factor, int impact, String description) {
}
