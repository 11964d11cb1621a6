package org.carball.rlsguard.analyzer;

import org.carball.rlsguard.analyzer.security.TautologyBypassRule;
import org.carball.rlsguard.model.analysis.BypassRisk;
import org.carball.rlsguard.model.analysis.InjectionType;
import org.carball.rlsguard.model.analysis.RecommendationPriority;
import org.carball.rlsguard.model.analysis.SecurityAnalysis;
import org.carball.rlsguard.model.analysis.SecurityRecommendation;
import org.carball.rlsguard.model.analysis.SecurityStrength;
import org.carball.rlsguard.model.analysis.SecurityVulnerability;
import org.carball.rlsguard.model.analysis.Severity;
import org.carball.rlsguard.model.analysis.VulnerabilityType;
import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.parser.PolicyExpressionParser;
import org.carball.rlsguard.parser.SubqueryParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SecurityAnalyzerTest {

    private SecurityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SecurityAnalyzer();
    }

    private SecurityAnalysis analyze(String expression) {
        PolicyConditionNode ast = PolicyExpressionParser.parse(expression, new SubqueryParser(3), 0);
        return analyzer.analyzeSecurityImplications(ast, expression);
    }

    @Test
    void shouldRateUserIsolationAsExcellent() {
        // When
        SecurityAnalysis security = analyze("auth.uid() = user_id");

        // Then
        assertThat(security.getVulnerabilities()).isEmpty();
        assertThat(security.getBypassRisks()).isEmpty();
        assertThat(security.getScore()).isEqualTo(100);
        assertThat(security.getStrength()).isEqualTo(SecurityStrength.EXCELLENT);
    }

    @Test
    void shouldFlagUnconditionalTrueAsDataLeak() {
        // When
        SecurityAnalysis security = analyze("true");

        // Then - 100 - 20 (high vulnerability) - 15 (no identity check)
        assertThat(security.getVulnerabilities()).singleElement().satisfies(vulnerability -> {
            assertThat(vulnerability.severity()).isEqualTo(Severity.HIGH);
            assertThat(vulnerability.type()).isEqualTo(VulnerabilityType.DATA_LEAK);
            assertThat(vulnerability.cwe()).isEqualTo("CWE-285");
        });
        assertThat(security.getBypassRisks()).extracting(BypassRisk::method)
                .containsExactly("No user context required");
        assertThat(security.getScore()).isEqualTo(65);
        assertThat(security.getStrength()).isEqualTo(SecurityStrength.STRONG);
    }

    @Test
    void shouldPenalizeLogicalBypass() {
        // When
        SecurityAnalysis security = analyze("owner_id = 5 OR true");

        // Then - 100 - 20 - 15 - 30
        assertThat(security.getBypassRisks()).extracting(BypassRisk::method)
                .containsExactly("No user context required", "Logical bypass");
        assertThat(security.getScore()).isEqualTo(35);
        assertThat(security.getStrength()).isEqualTo(SecurityStrength.WEAK);
    }

    @Test
    void shouldFindTautologyInTreeRegardlessOfSpacing() {
        // When
        SecurityAnalysis security = analyze("owner = current_user or 1  =  1");

        // Then
        assertThat(security.getBypassRisks()).extracting(BypassRisk::method).containsExactly("Logical bypass");
    }

    @Test
    void shouldReportStatementInjectionAsCritical() {
        // When - text only, as for an expression that did not parse
        SecurityAnalysis security = analyzer.analyzeSecurityImplications(null,
                "user_id = auth.uid(); DROP TABLE users");

        // Then
        assertThat(security.getVulnerabilities()).singleElement().satisfies(vulnerability -> {
            assertThat(vulnerability.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(vulnerability.type()).isEqualTo(VulnerabilityType.INJECTION);
            assertThat(vulnerability.id()).isEqualTo("injection-risk-0");
            assertThat(vulnerability.cwe()).isEqualTo("CWE-89");
        });
        assertThat(security.getInjectionRisks()).singleElement().satisfies(risk -> {
            assertThat(risk.type()).isEqualTo(InjectionType.SQL_INJECTION);
            assertThat(risk.example()).isEqualTo("; DROP");
        });
        assertThat(security.getScore()).isEqualTo(100 - 40 + 10);
    }

    @Test
    void shouldDetectDynamicExecutionAndDollarQuoting() {
        // When
        SecurityAnalysis security = analyzer.analyzeSecurityImplications(null,
                "auth.uid() = owner AND EXECUTE $$select 1$$");

        // Then
        assertThat(security.getVulnerabilities()).extracting(SecurityVulnerability::id)
                .containsExactly("injection-risk-0", "injection-risk-1");
        assertThat(security.getInjectionRisks()).hasSize(2);
    }

    @Test
    void shouldRewardSessionRoleChecks() {
        // When
        SecurityAnalysis security = analyze("owner = current_user");

        // Then
        assertThat(security.getBypassRisks()).isEmpty();
        assertThat(security.getScore()).isEqualTo(100);
    }

    @Test
    void shouldDeriveRecommendationPriorityFromSeverity() {
        // When
        SecurityAnalysis security = analyzer.analyzeSecurityImplications(null,
                "name = 'x'; DELETE FROM users");

        // Then
        List<SecurityRecommendation> recommendations = security.getRecommendations();
        assertThat(recommendations).extracting(SecurityRecommendation::priority)
                .containsExactly(RecommendationPriority.IMMEDIATE, RecommendationPriority.HIGH);
        assertThat(recommendations.get(0).recommendation())
                .isEqualTo("Use parameterized queries and avoid dynamic SQL construction");
    }

    @Test
    void shouldRunOnlyConfiguredRules() {
        // Given
        SecurityAnalyzer tautologyOnly = new SecurityAnalyzer(List.of(new TautologyBypassRule()));
        PolicyConditionNode ast = PolicyExpressionParser.parse("true", new SubqueryParser(3), 0);

        // When
        SecurityAnalysis security = tautologyOnly.analyzeSecurityImplications(ast, "true");

        // Then
        assertThat(security.getVulnerabilities()).isEmpty();
        assertThat(security.getBypassRisks()).isEmpty();
        assertThat(security.getScore()).isEqualTo(100);
    }
}
