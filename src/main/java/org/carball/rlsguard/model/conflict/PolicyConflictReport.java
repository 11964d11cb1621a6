package org.carball.rlsguard.model.conflict;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class PolicyConflictReport {
    @Builder.Default
    private List<PolicyConflict> conflicts = List.of();
    @Builder.Default
    private List<PolicyOverlap> overlaps = List.of();
    @Builder.Default
    private List<PolicyGap> gaps = List.of();
    @Builder.Default
    private List<ConflictResolution> recommendations = List.of();

    public static PolicyConflictReport empty() {
        return PolicyConflictReport.builder().build();
    }

    /**
     * Concatenates the sections of several reports, in order.
     */
    public static PolicyConflictReport merge(List<PolicyConflictReport> reports) {
        List<PolicyConflict> conflicts = new ArrayList<>();
        List<PolicyOverlap> overlaps = new ArrayList<>();
        List<PolicyGap> gaps = new ArrayList<>();
        List<ConflictResolution> recommendations = new ArrayList<>();
        for (PolicyConflictReport report : reports) {
            conflicts.addAll(report.getConflicts());
            overlaps.addAll(report.getOverlaps());
            gaps.addAll(report.getGaps());
            recommendations.addAll(report.getRecommendations());
        }
        return PolicyConflictReport.builder()
                .conflicts(List.copyOf(conflicts))
                .overlaps(List.copyOf(overlaps))
                .gaps(List.copyOf(gaps))
                .recommendations(List.copyOf(recommendations))
                .build();
    }

    @JsonIgnore
    public boolean isClean() {
        return conflicts.isEmpty() && overlaps.isEmpty() && gaps.isEmpty();
    }
}
