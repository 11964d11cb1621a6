package org.carball.rlsguard.parser;

import org.carball.rlsguard.model.policy.PolicyCommand;
import org.carball.rlsguard.model.policy.PolicyDefinition;
import org.carball.rlsguard.model.policy.PolicyMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PolicySetReaderTest {

    private PolicySetReader reader;

    @BeforeEach
    void setUp() {
        reader = new PolicySetReader();
    }

    @Test
    void shouldReadJsonPolicies(@TempDir Path tempDir) throws Exception {
        // Given
        Path file = tempDir.resolve("policies.json");
        Files.writeString(file, """
            [
              {"name": "own_rows", "table": "documents", "expression": "owner_id = auth.uid()",
               "command": "select", "type": "PERMISSIVE"},
              {"name": "guard", "table": "documents", "expression": "org_id = 1",
               "command": "ALL", "type": "restrictive", "roles": ["authenticated"]}
            ]
            """);

        // When
        List<PolicyDefinition> policies = reader.read(file);

        // Then
        assertThat(policies).hasSize(2);
        assertThat(policies.get(0)).isEqualTo(new PolicyDefinition(
                "own_rows", "documents", "owner_id = auth.uid()", PolicyCommand.SELECT, PolicyMode.PERMISSIVE));
        assertThat(policies.get(1).command()).isEqualTo(PolicyCommand.ALL);
        assertThat(policies.get(1).type()).isEqualTo(PolicyMode.RESTRICTIVE);
    }

    @Test
    void shouldReadYamlPoliciesAndDefaultToPermissive(@TempDir Path tempDir) throws Exception {
        // Given
        Path file = tempDir.resolve("policies.yaml");
        Files.writeString(file, """
            - name: delete_own
              table: documents
              expression: owner_id = auth.uid()
              command: DELETE
            """);

        // When
        List<PolicyDefinition> policies = reader.read(file);

        // Then
        assertThat(policies).singleElement().satisfies(policy -> {
            assertThat(policy.command()).isEqualTo(PolicyCommand.DELETE);
            assertThat(policy.type()).isEqualTo(PolicyMode.PERMISSIVE);
            assertThat(policy.expression()).isEqualTo("owner_id = auth.uid()");
        });
    }

    @Test
    void shouldFailForMissingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("absent.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Policy file not found");
    }

    @Test
    void shouldRejectUnknownCommand(@TempDir Path tempDir) throws Exception {
        // Given
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, """
            [{"name": "p", "expression": "true", "command": "TRUNCATE"}]
            """);

        // When/Then
        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bad.json");
    }

    @Test
    void shouldRejectMalformedContent(@TempDir Path tempDir) throws Exception {
        // Given
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "[{\"name\": ");

        // When/Then
        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid policy definitions in broken.json");
    }
}
