package org.carball.rlsguard.model.analysis;

import java.util.List;

public record IndexRequirement(
        List<String> columns,
        IndexType type,
        ImpactLevel priority,
        String rationale
) {

    public IndexRequirement {
        columns = List.copyOf(columns);
    }
}
