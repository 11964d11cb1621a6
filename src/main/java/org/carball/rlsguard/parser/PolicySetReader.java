package org.carball.rlsguard.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.rlsguard.model.policy.PolicyDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads policy definitions from a JSON or YAML file holding an array of
 * {@code {name, table, expression, command, type}} objects. Files ending in {@code .yml} or
 * {@code .yaml} are read as YAML, anything else as JSON.
 */
@Slf4j
public class PolicySetReader {

    private static final TypeReference<List<PolicyDefinition>> POLICY_LIST = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public PolicySetReader() {
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
    }

    public List<PolicyDefinition> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new IOException("Policy file not found: " + file);
        }

        ObjectMapper mapper = isYaml(file) ? yamlMapper : jsonMapper;
        List<PolicyDefinition> policies;
        try {
            policies = mapper.readValue(file.toFile(), POLICY_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid policy definitions in " + file.getFileName()
                    + ": " + e.getOriginalMessage(), e);
        }

        if (policies == null) {
            policies = List.of();
        }
        log.info("Read {} policy definitions from {}", policies.size(), file);
        return policies;
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
