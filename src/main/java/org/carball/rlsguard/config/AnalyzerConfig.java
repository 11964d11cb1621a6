package org.carball.rlsguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runtime knobs of the policy parser. Scoring weights are not configurable.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class AnalyzerConfig {

    /** How many levels of {@code (SELECT ... WHERE (SELECT ...))} get their WHERE parsed. */
    @Builder.Default
    @JsonProperty("max_subquery_depth")
    private int maxSubqueryDepth = 3;

    /** Characters of the expression included in debug logging. */
    @Builder.Default
    @JsonProperty("expression_preview_length")
    private int expressionPreviewLength = 100;

    @Builder.Default
    @JsonProperty("parallel_conflict_detection")
    private boolean parallelConflictDetection = false;

    @Builder.Default
    @JsonProperty("conflict_detection_enabled")
    private boolean conflictDetectionEnabled = true;

    public static AnalyzerConfig defaults() {
        return AnalyzerConfig.builder().build();
    }

    /**
     * Logs warnings for values that will make the analysis behave oddly.
     */
    public void validate() {
        if (maxSubqueryDepth < 0) {
            log.warn("Max subquery depth ({}) is negative; subquery conditions will not be parsed", maxSubqueryDepth);
        } else if (maxSubqueryDepth == 0) {
            log.warn("Max subquery depth is 0; subquery conditions will not be parsed");
        }

        if (expressionPreviewLength <= 0) {
            log.warn("Expression preview length ({}) should be positive", expressionPreviewLength);
        }

        if (!conflictDetectionEnabled && parallelConflictDetection) {
            log.warn("Parallel conflict detection is set but conflict detection is disabled");
        }
    }

    public String getConfigurationSummary() {
        return String.format("maxSubqueryDepth=%d, previewLength=%d, conflictDetection=%s, parallel=%s",
                maxSubqueryDepth, expressionPreviewLength, conflictDetectionEnabled, parallelConflictDetection);
    }
}
