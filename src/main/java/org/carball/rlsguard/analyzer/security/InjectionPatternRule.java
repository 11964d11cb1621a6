package org.carball.rlsguard.analyzer.security;

import org.carball.rlsguard.model.analysis.InjectionRisk;
import org.carball.rlsguard.model.analysis.InjectionType;
import org.carball.rlsguard.model.analysis.SecurityVulnerability;
import org.carball.rlsguard.model.analysis.Severity;
import org.carball.rlsguard.model.analysis.VulnerabilityType;
import org.carball.rlsguard.model.ast.PolicyConditionNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags text that looks like injected SQL as a critical vulnerability.
 */
public class InjectionPatternRule implements SecurityRule {

    private static final String MITIGATION = "Use parameterized queries and avoid dynamic SQL construction";

    private final String name;
    private final Pattern pattern;

    public InjectionPatternRule(String name, Pattern pattern) {
        this.name = name;
        this.pattern = pattern;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void evaluate(PolicyConditionNode ast, String expression, SecurityFindings findings) {
        Matcher matcher = pattern.matcher(expression);
        if (!matcher.find()) {
            return;
        }

        findings.addVulnerability(SecurityVulnerability.builder()
                .id("injection-risk-" + findings.vulnerabilityCount())
                .severity(Severity.CRITICAL)
                .type(VulnerabilityType.INJECTION)
                .description("Expression contains potential SQL injection pattern")
                .example(pattern.pattern())
                .mitigation(MITIGATION)
                .cwe("CWE-89")
                .build());
        findings.addInjectionRisk(new InjectionRisk(
                name,
                InjectionType.SQL_INJECTION,
                Severity.CRITICAL,
                matcher.group(),
                MITIGATION));
    }
}
