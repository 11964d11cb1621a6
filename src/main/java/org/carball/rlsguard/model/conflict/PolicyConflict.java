package org.carball.rlsguard.model.conflict;

import org.carball.rlsguard.model.analysis.Severity;

import java.util.List;

public record PolicyConflict(
        String id,
        Severity severity,
        ConflictType type,
        List<String> policies,
        String description,
        String example,
        String resolution
) {

    public PolicyConflict {
        policies = List.copyOf(policies);
    }
}
