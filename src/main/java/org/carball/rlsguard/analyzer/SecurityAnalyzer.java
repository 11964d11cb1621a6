package org.carball.rlsguard.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.rlsguard.analyzer.security.SecurityFindings;
import org.carball.rlsguard.analyzer.security.SecurityRule;
import org.carball.rlsguard.analyzer.security.SecurityRules;
import org.carball.rlsguard.model.analysis.BypassRisk;
import org.carball.rlsguard.model.analysis.Likelihood;
import org.carball.rlsguard.model.analysis.RecommendationImpact;
import org.carball.rlsguard.model.analysis.RecommendationPriority;
import org.carball.rlsguard.model.analysis.RiskImpact;
import org.carball.rlsguard.model.analysis.SecurityAnalysis;
import org.carball.rlsguard.model.analysis.SecurityRecommendation;
import org.carball.rlsguard.model.analysis.SecurityStrength;
import org.carball.rlsguard.model.analysis.SecurityVulnerability;
import org.carball.rlsguard.model.ast.PolicyConditionNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the security rule table over a policy and scores the findings. The checks are
 * pattern heuristics: a clean result is not a proof that the policy is safe.
 */
@Slf4j
public class SecurityAnalyzer {

    private static final int BASE_SCORE = 100;
    private static final int SEVERE_BYPASS_PENALTY = 30;
    private static final int HIGH_BYPASS_PENALTY = 15;
    private static final int AUTH_UID_BONUS = 10;
    private static final int SESSION_ROLE_BONUS = 5;

    private final List<SecurityRule> rules;

    public SecurityAnalyzer() {
        this(SecurityRules.defaults());
    }

    public SecurityAnalyzer(List<SecurityRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @param ast        parsed tree, or null to scan the text only
     * @param expression normalized expression text
     */
    public SecurityAnalysis analyzeSecurityImplications(PolicyConditionNode ast, String expression) {
        SecurityFindings findings = new SecurityFindings();
        for (SecurityRule rule : rules) {
            int before = findings.vulnerabilityCount() + findings.getBypassRisks().size();
            rule.evaluate(ast, expression, findings);
            if (findings.vulnerabilityCount() + findings.getBypassRisks().size() > before) {
                log.trace("Security rule {} matched '{}'", rule.name(), expression);
            }
        }

        int score = calculateSecurityScore(findings, expression);

        return SecurityAnalysis.builder()
                .strength(SecurityStrength.fromScore(score))
                .score(score)
                .vulnerabilities(List.copyOf(findings.getVulnerabilities()))
                .bypassRisks(List.copyOf(findings.getBypassRisks()))
                .injectionRisks(List.copyOf(findings.getInjectionRisks()))
                .recommendations(List.copyOf(generateRecommendations(findings)))
                .build();
    }

    private int calculateSecurityScore(SecurityFindings findings, String expression) {
        int score = BASE_SCORE;

        for (SecurityVulnerability vulnerability : findings.getVulnerabilities()) {
            score -= vulnerability.severity().getScorePenalty();
        }

        for (BypassRisk risk : findings.getBypassRisks()) {
            if (risk.likelihood() == Likelihood.VERY_HIGH && risk.impact() == RiskImpact.SEVERE) {
                score -= SEVERE_BYPASS_PENALTY;
            } else if (risk.likelihood() == Likelihood.HIGH || risk.impact() == RiskImpact.HIGH) {
                score -= HIGH_BYPASS_PENALTY;
            }
        }

        if (expression.contains("auth.uid()")) {
            score += AUTH_UID_BONUS;
        }
        if (expression.contains("current_user") || expression.contains("session_user")) {
            score += SESSION_ROLE_BONUS;
        }

        return Math.max(0, Math.min(100, score));
    }

    private List<SecurityRecommendation> generateRecommendations(SecurityFindings findings) {
        Map<String, SecurityRecommendation> recommendations = new LinkedHashMap<>();

        for (SecurityVulnerability vulnerability : findings.getVulnerabilities()) {
            recommendations.putIfAbsent(vulnerability.mitigation(), new SecurityRecommendation(
                    priorityFor(vulnerability),
                    vulnerability.mitigation(),
                    vulnerability.description(),
                    vulnerability.cwe() == null ? "Rewrite the policy expression"
                            : "Rewrite the policy expression to remove " + vulnerability.cwe(),
                    RecommendationImpact.POSITIVE));
        }

        for (BypassRisk risk : findings.getBypassRisks()) {
            recommendations.putIfAbsent(risk.prevention(), new SecurityRecommendation(
                    risk.impact() == RiskImpact.SEVERE ? RecommendationPriority.IMMEDIATE : RecommendationPriority.HIGH,
                    risk.prevention(),
                    risk.description(),
                    "Tighten the condition: " + risk.method(),
                    RecommendationImpact.POSITIVE));
        }

        return List.copyOf(recommendations.values());
    }

    private static RecommendationPriority priorityFor(SecurityVulnerability vulnerability) {
        return switch (vulnerability.severity()) {
            case CRITICAL -> RecommendationPriority.IMMEDIATE;
            case HIGH -> RecommendationPriority.HIGH;
            case MEDIUM -> RecommendationPriority.MEDIUM;
            case LOW, INFO -> RecommendationPriority.LOW;
        };
    }
}
