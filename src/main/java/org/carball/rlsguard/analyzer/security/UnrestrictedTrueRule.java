package org.carball.rlsguard.analyzer.security;

import org.carball.rlsguard.model.analysis.SecurityVulnerability;
import org.carball.rlsguard.model.analysis.Severity;
import org.carball.rlsguard.model.analysis.VulnerabilityType;
import org.carball.rlsguard.model.ast.PolicyConditionNode;

/**
 * A {@code true} anywhere in a policy that never looks at {@code auth.uid()} is treated as
 * granting every row.
 */
public class UnrestrictedTrueRule implements SecurityRule {

    @Override
    public String name() {
        return "UNRESTRICTED_TRUE";
    }

    @Override
    public void evaluate(PolicyConditionNode ast, String expression, SecurityFindings findings) {
        if (!expression.contains("true") || expression.contains(SecurityRules.AUTH_UID_CALL)) {
            return;
        }

        findings.addVulnerability(SecurityVulnerability.builder()
                .id("permissive-" + findings.vulnerabilityCount())
                .severity(Severity.HIGH)
                .type(VulnerabilityType.DATA_LEAK)
                .description("Policy allows unrestricted access with \"true\" condition")
                .mitigation("Replace with appropriate access control logic")
                .cwe("CWE-285")
                .build());
    }
}
