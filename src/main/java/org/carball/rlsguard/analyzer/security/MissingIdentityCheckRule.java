package org.carball.rlsguard.analyzer.security;

import org.carball.rlsguard.model.analysis.BypassRisk;
import org.carball.rlsguard.model.analysis.Likelihood;
import org.carball.rlsguard.model.analysis.RiskImpact;
import org.carball.rlsguard.model.ast.PolicyConditionNode;

public class MissingIdentityCheckRule implements SecurityRule {

    @Override
    public String name() {
        return "MISSING_IDENTITY_CHECK";
    }

    @Override
    public void evaluate(PolicyConditionNode ast, String expression, SecurityFindings findings) {
        if (expression.contains(SecurityRules.AUTH_UID_CALL) || expression.contains("current_user")) {
            return;
        }

        findings.addBypassRisk(new BypassRisk(
                "No user context required",
                Likelihood.HIGH,
                RiskImpact.HIGH,
                "Policy does not verify user identity, allowing potential unauthorized access",
                "Add user authentication checks using auth.uid() or similar functions"));
    }
}
