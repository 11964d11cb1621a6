package org.carball.rlsguard.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.rlsguard.analyzer.ComplexityScorer;
import org.carball.rlsguard.analyzer.ConflictDetector;
import org.carball.rlsguard.analyzer.DependencyAnalyzer;
import org.carball.rlsguard.analyzer.PerformanceAnalyzer;
import org.carball.rlsguard.analyzer.PolicyValidator;
import org.carball.rlsguard.analyzer.SecurityAnalyzer;
import org.carball.rlsguard.config.AnalyzerConfig;
import org.carball.rlsguard.model.analysis.ComplexityFactor;
import org.carball.rlsguard.model.analysis.ComplexityLevel;
import org.carball.rlsguard.model.analysis.Maintainability;
import org.carball.rlsguard.model.analysis.PerformanceAnalysis;
import org.carball.rlsguard.model.analysis.PerformanceImpact;
import org.carball.rlsguard.model.analysis.PolicyComplexity;
import org.carball.rlsguard.model.analysis.PolicyIssue;
import org.carball.rlsguard.model.analysis.SecurityAnalysis;
import org.carball.rlsguard.model.analysis.SecurityStrength;
import org.carball.rlsguard.model.analysis.SecurityVulnerability;
import org.carball.rlsguard.model.analysis.Severity;
import org.carball.rlsguard.model.analysis.Testability;
import org.carball.rlsguard.model.analysis.VulnerabilityType;
import org.carball.rlsguard.model.ast.NodeType;
import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.model.ast.PolicyTrees;
import org.carball.rlsguard.model.conflict.PolicyConflictReport;
import org.carball.rlsguard.model.policy.ExpressionType;
import org.carball.rlsguard.model.policy.ParsedPolicyCondition;
import org.carball.rlsguard.model.policy.PolicyDefinition;
import org.carball.rlsguard.model.policy.PolicyDependency;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for analyzing RLS policy expressions. {@link #parsePolicy(String)} never
 * throws: an expression that cannot be parsed yields a fallback analysis that scores it as
 * maximally complex and very weak.
 */
@Slf4j
public class RlsPolicyParser {

    private static final int FALLBACK_OVERHEAD_PERCENT = 50;

    private final AnalyzerConfig config;
    private final SubqueryParser subqueryParser;
    private final DependencyAnalyzer dependencyAnalyzer;
    private final ComplexityScorer complexityScorer;
    private final SecurityAnalyzer securityAnalyzer;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final PolicyValidator policyValidator;

    public RlsPolicyParser() {
        this(AnalyzerConfig.defaults());
    }

    public RlsPolicyParser(AnalyzerConfig config) {
        this(config, new SecurityAnalyzer());
    }

    public RlsPolicyParser(AnalyzerConfig config, SecurityAnalyzer securityAnalyzer) {
        this.config = Objects.requireNonNull(config, "config");
        this.subqueryParser = new SubqueryParser(config.getMaxSubqueryDepth());
        this.dependencyAnalyzer = new DependencyAnalyzer();
        this.complexityScorer = new ComplexityScorer();
        this.securityAnalyzer = Objects.requireNonNull(securityAnalyzer, "securityAnalyzer");
        this.performanceAnalyzer = new PerformanceAnalyzer();
        this.policyValidator = new PolicyValidator();
    }

    /**
     * Parses and analyzes one USING / WITH CHECK expression.
     */
    public ParsedPolicyCondition parsePolicy(String expression) {
        String normalized = normalize(expression);
        log.debug("Parsing RLS policy expression: {}", preview(normalized));

        try {
            PolicyConditionNode ast = PolicyExpressionParser.parse(normalized, subqueryParser, 0);

            List<PolicyDependency> dependencies = dependencyAnalyzer.analyzeDependencies(ast, normalized);
            PolicyComplexity complexity = complexityScorer.calculateComplexity(ast, dependencies);
            SecurityAnalysis security = securityAnalyzer.analyzeSecurityImplications(ast, normalized);
            PerformanceAnalysis performance = performanceAnalyzer.analyzePerformanceImpact(ast, dependencies);

            return ParsedPolicyCondition.builder()
                    .type(determineExpressionType(ast, complexity))
                    .expression(normalized)
                    .conditions(List.of(ast))
                    .dependencies(List.copyOf(dependencies))
                    .complexity(complexity)
                    .security(security)
                    .performance(performance)
                    .fallback(false)
                    .build();
        } catch (PolicyParseException e) {
            log.error("Failed to parse RLS policy expression '{}': {}", preview(normalized), e.getMessage());
            return createFallbackAnalysis(normalized, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Analysis of RLS policy expression '{}' failed", preview(normalized), e);
            return createFallbackAnalysis(normalized, e.getMessage());
        }
    }

    /**
     * Compares the given policies pairwise. All policies are assumed to belong to the same
     * table; see {@link org.carball.rlsguard.analyzer.PolicySetAnalyzer} for mixed sets.
     */
    public PolicyConflictReport detectPolicyConflicts(List<PolicyDefinition> policies) {
        return new ConflictDetector(this::parsePolicy, config.isParallelConflictDetection())
                .detectPolicyConflicts(policies);
    }

    public List<PolicyIssue> validatePolicyLogic(ParsedPolicyCondition parsed) {
        return policyValidator.validatePolicyLogic(Objects.requireNonNull(parsed, "parsed"));
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    private static ExpressionType determineExpressionType(PolicyConditionNode ast, PolicyComplexity complexity) {
        if (complexity.level() == ComplexityLevel.TRIVIAL || complexity.level() == ComplexityLevel.SIMPLE) {
            return ExpressionType.SIMPLE;
        }
        if (PolicyTrees.count(ast, NodeType.SUBQUERY) > 0) {
            return ExpressionType.SUBQUERY;
        }
        if (PolicyTrees.count(ast, NodeType.FUNCTION) > 0) {
            return ExpressionType.FUNCTION_CALL;
        }
        if (PolicyTrees.count(ast, NodeType.LOGICAL) > 2) {
            return ExpressionType.COMPOUND;
        }
        return ExpressionType.COMPLEX;
    }

    private ParsedPolicyCondition createFallbackAnalysis(String expression, String reason) {
        PolicyComplexity complexity = new PolicyComplexity(
                100,
                ComplexityLevel.EXTREME,
                List.of(new ComplexityFactor("Parse Error", 100, "Failed to parse expression: " + reason)),
                Maintainability.VERY_POOR,
                Testability.VERY_DIFFICULT);

        // Injection patterns are still worth reporting when the tree is missing
        SecurityAnalysis textScan = securityAnalyzer.analyzeSecurityImplications(null, expression);

        SecurityAnalysis security = SecurityAnalysis.builder()
                .strength(SecurityStrength.VERY_WEAK)
                .score(0)
                .vulnerabilities(List.of(SecurityVulnerability.builder()
                        .id("parse-error")
                        .severity(Severity.HIGH)
                        .type(VulnerabilityType.BYPASS)
                        .description("Expression could not be parsed, security analysis incomplete")
                        .example(expression)
                        .mitigation("Fix syntax errors and re-analyze")
                        .cwe("CWE-1173")
                        .build()))
                .injectionRisks(textScan.getInjectionRisks())
                .build();

        PerformanceAnalysis performance = PerformanceAnalysis.builder()
                .impact(PerformanceImpact.HIGH)
                .estimatedOverhead(FALLBACK_OVERHEAD_PERCENT)
                .build();

        return ParsedPolicyCondition.builder()
                .type(ExpressionType.COMPLEX)
                .expression(expression)
                .complexity(complexity)
                .security(security)
                .performance(performance)
                .fallback(true)
                .build();
    }

    private static String normalize(String expression) {
        return expression == null ? "" : expression.trim().replaceAll("\\s+", " ");
    }

    private String preview(String expression) {
        int length = Math.max(0, config.getExpressionPreviewLength());
        return expression.length() > length ? expression.substring(0, length) + "..." : expression;
    }
}
