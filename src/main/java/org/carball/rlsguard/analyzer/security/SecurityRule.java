package org.carball.rlsguard.analyzer.security;

import org.carball.rlsguard.model.ast.PolicyConditionNode;

/**
 * One heuristic of the security scan. Rules only report findings; scoring happens in
 * {@link org.carball.rlsguard.analyzer.SecurityAnalyzer}.
 */
public interface SecurityRule {

    /**
     * Rule name used in logs.
     */
    String name();

    void evaluate(PolicyConditionNode ast, String expression, SecurityFindings findings);
}
