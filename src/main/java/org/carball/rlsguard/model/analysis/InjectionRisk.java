package org.carball.rlsguard.model.analysis;

public record InjectionRisk(
        String vector,
        InjectionType type,
        Severity severity,
        String example,
        String prevention
) {
}
