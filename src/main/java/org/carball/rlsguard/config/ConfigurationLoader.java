package org.carball.rlsguard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.OptionalInt;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_MAX_SUBQUERY_DEPTH = "RLSGUARD_MAX_SUBQUERY_DEPTH";
    static final String ENV_EXPRESSION_PREVIEW_LENGTH = "RLSGUARD_EXPRESSION_PREVIEW_LENGTH";
    static final String ENV_PARALLEL_CONFLICT_DETECTION = "RLSGUARD_PARALLEL_CONFLICT_DETECTION";
    static final String ENV_CONFLICT_DETECTION_ENABLED = "RLSGUARD_CONFLICT_DETECTION_ENABLED";

    private final ObjectMapper yamlMapper;
    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads configuration using the hierarchy: env vars > defaults
     */
    public AnalyzerConfig loadConfiguration() {
        log.debug("Loading configuration");

        AnalyzerConfig.AnalyzerConfigBuilder builder = AnalyzerConfig.defaults().toBuilder();
        applyEnvironmentVariables(builder);

        AnalyzerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads configuration using the hierarchy: env vars > YAML file > defaults
     */
    public AnalyzerConfig loadConfiguration(Path yamlFile) throws IOException {
        if (yamlFile == null || !Files.exists(yamlFile)) {
            log.debug("No configuration file at {}, using defaults", yamlFile);
            return loadConfiguration();
        }

        AnalyzerConfig fromFile;
        try {
            // keys missing from the file keep their default values
            fromFile = yamlMapper.readerForUpdating(AnalyzerConfig.defaults()).readValue(yamlFile.toFile());
        } catch (IOException e) {
            log.error("Error reading configuration file: {} - {}", yamlFile, e.getMessage());
            throw e;
        }
        if (fromFile == null) {
            fromFile = AnalyzerConfig.defaults();
        }

        AnalyzerConfig.AnalyzerConfigBuilder builder = fromFile.toBuilder();
        applyEnvironmentVariables(builder);

        AnalyzerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded from {}: {}", yamlFile, config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(AnalyzerConfig.AnalyzerConfigBuilder builder) {
        if (environment.containsKey(ENV_MAX_SUBQUERY_DEPTH)) {
            parseInt(ENV_MAX_SUBQUERY_DEPTH).ifPresent(builder::maxSubqueryDepth);
        }
        if (environment.containsKey(ENV_EXPRESSION_PREVIEW_LENGTH)) {
            parseInt(ENV_EXPRESSION_PREVIEW_LENGTH).ifPresent(builder::expressionPreviewLength);
        }
        if (environment.containsKey(ENV_PARALLEL_CONFLICT_DETECTION)) {
            builder.parallelConflictDetection(Boolean.parseBoolean(environment.get(ENV_PARALLEL_CONFLICT_DETECTION)));
        }
        if (environment.containsKey(ENV_CONFLICT_DETECTION_ENABLED)) {
            builder.conflictDetectionEnabled(Boolean.parseBoolean(environment.get(ENV_CONFLICT_DETECTION_ENABLED)));
        }
    }

    private OptionalInt parseInt(String key) {
        String value = environment.get(key);
        try {
            return OptionalInt.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
            return OptionalInt.empty();
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            YAML file keys:
              max_subquery_depth            Nesting levels of subquery WHERE clauses to parse (default 3)
              expression_preview_length     Characters of each expression shown in debug logs (default 100)
              parallel_conflict_detection   Compare policy pairs on worker threads (default false)
              conflict_detection_enabled    Run conflict detection in policy-set analysis (default true)

            Environment Variables:
              RLSGUARD_MAX_SUBQUERY_DEPTH            Same as max_subquery_depth
              RLSGUARD_EXPRESSION_PREVIEW_LENGTH     Same as expression_preview_length
              RLSGUARD_PARALLEL_CONFLICT_DETECTION   Same as parallel_conflict_detection
              RLSGUARD_CONFLICT_DETECTION_ENABLED    Same as conflict_detection_enabled

            Priority Order (highest to lowest):
              1. Environment variables
              2. YAML file
              3. Built-in defaults
            """;
    }
}
