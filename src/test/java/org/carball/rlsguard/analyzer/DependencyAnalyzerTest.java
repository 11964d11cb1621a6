package org.carball.rlsguard.analyzer;

import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.model.policy.DependencyType;
import org.carball.rlsguard.model.policy.PolicyDependency;
import org.carball.rlsguard.parser.PolicyExpressionParser;
import org.carball.rlsguard.parser.SubqueryParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

public class DependencyAnalyzerTest {

    private DependencyAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new DependencyAnalyzer();
    }

    private List<PolicyDependency> analyze(String expression) {
        PolicyConditionNode ast = PolicyExpressionParser.parse(expression, new SubqueryParser(3), 0);
        return analyzer.analyzeDependencies(ast, expression);
    }

    private static List<PolicyDependency> ofType(List<PolicyDependency> dependencies, DependencyType type) {
        return dependencies.stream().filter(d -> d.type() == type).collect(Collectors.toList());
    }

    @Test
    void shouldDeduplicateRepeatedReferences() {
        // When
        List<PolicyDependency> dependencies = analyze("user_id = auth.uid() AND (role = 'admin' OR role = 'owner')");

        // Then
        assertThat(ofType(dependencies, DependencyType.FUNCTION)).extracting(PolicyDependency::name)
                .containsExactly("auth.uid");
        assertThat(ofType(dependencies, DependencyType.COLUMN)).extracting(PolicyDependency::name)
                .containsExactly("user_id", "role");
        assertThat(ofType(dependencies, DependencyType.SESSION_VARIABLE)).extracting(PolicyDependency::name)
                .containsExactly("auth.uid");
        assertThat(dependencies).hasSize(4);
    }

    @Test
    void shouldDescribeSensitiveColumns() {
        // When
        PolicyDependency column = ofType(analyze("user_id = auth.uid()"), DependencyType.COLUMN).get(0);

        // Then
        assertThat(column.description()).isEqualTo("Column reference: user_id");
        assertThat(column.securityImplications()).containsExactly(
                "Contains identifying information",
                "User-related data - high privacy sensitivity");
    }

    @Test
    void shouldDescribeSecurityFunctions() {
        // When
        PolicyDependency function = ofType(analyze("auth.uid() = owner"), DependencyType.FUNCTION).get(0);

        // Then
        assertThat(function.description()).isEqualTo("Function call: auth.uid()");
        assertThat(function.securityImplications()).contains(
                "Security-related function - critical for access control",
                "Authentication function - ensure proper context");
    }

    @Test
    void shouldFindRoleReferencesInText() {
        // When
        List<PolicyDependency> dependencies = analyze("owner = current_user");

        // Then
        assertThat(ofType(dependencies, DependencyType.ROLE)).extracting(PolicyDependency::name)
                .containsExactly("current_user");
        assertThat(ofType(dependencies, DependencyType.SESSION_VARIABLE)).isEmpty();
    }

    @Test
    void shouldReportTablesReadBySubqueries() {
        // When
        List<PolicyDependency> dependencies = analyze(
                "team_id IN (SELECT m.team_id FROM members m JOIN teams t ON t.id = m.team_id WHERE m.user_id = auth.uid())");

        // Then
        assertThat(ofType(dependencies, DependencyType.TABLE)).extracting(PolicyDependency::name)
                .containsExactly("members", "teams");
        assertThat(ofType(dependencies, DependencyType.TABLE).get(0).securityImplications())
                .containsExactly("Row-level security on members also applies inside the policy");
    }

    @Test
    void shouldNeverRepeatTypeAndName() {
        // When
        List<PolicyDependency> dependencies = analyze(
                "a = 1 AND a = 2 AND f(a) = f(b) AND current_user = a AND current_user = b");

        // Then
        assertThat(dependencies).extracting(d -> d.type() + ":" + d.name()).doesNotHaveDuplicates();
    }
}
