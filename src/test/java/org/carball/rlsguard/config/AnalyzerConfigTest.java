package org.carball.rlsguard.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

public class AnalyzerConfigTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(AnalyzerConfig.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setLevel(null);
        logger.setAdditive(true);
    }

    @Test
    void shouldCreateDefaultConfig() {
        // When
        AnalyzerConfig config = AnalyzerConfig.defaults();

        // Then
        assertThat(config.getMaxSubqueryDepth()).isEqualTo(3);
        assertThat(config.getExpressionPreviewLength()).isEqualTo(100);
        assertThat(config.isParallelConflictDetection()).isFalse();
        assertThat(config.isConflictDetectionEnabled()).isTrue();
    }

    @Test
    void shouldNotWarnForDefaults() {
        // When
        AnalyzerConfig.defaults().validate();

        // Then
        assertThat(logAppender.list).isEmpty();
    }

    @Test
    void shouldWarnForNegativeSubqueryDepth() {
        // Given
        AnalyzerConfig config = AnalyzerConfig.builder().maxSubqueryDepth(-1).build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("Max subquery depth (-1) is negative");
        });
    }

    @Test
    void shouldWarnForNonPositivePreviewAndParallelWithoutDetection() {
        // Given
        AnalyzerConfig config = AnalyzerConfig.builder()
                .expressionPreviewLength(0)
                .conflictDetectionEnabled(false)
                .parallelConflictDetection(true)
                .build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list).hasSize(2);
        assertThat(logAppender.list).allMatch(event -> event.getLevel() == Level.WARN);
    }

    @Test
    void shouldSummarizeConfiguration() {
        assertThat(AnalyzerConfig.defaults().getConfigurationSummary())
                .isEqualTo("maxSubqueryDepth=3, previewLength=100, conflictDetection=true, parallel=false");
    }
}
