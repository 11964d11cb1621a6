package org.carball.rlsguard.analyzer.security;

import org.carball.rlsguard.model.analysis.BypassRisk;
import org.carball.rlsguard.model.analysis.InjectionRisk;
import org.carball.rlsguard.model.analysis.SecurityVulnerability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates what the rules of one scan report.
 */
public class SecurityFindings {

    private final List<SecurityVulnerability> vulnerabilities = new ArrayList<>();
    private final List<BypassRisk> bypassRisks = new ArrayList<>();
    private final List<InjectionRisk> injectionRisks = new ArrayList<>();

    public void addVulnerability(SecurityVulnerability vulnerability) {
        vulnerabilities.add(vulnerability);
    }

    public void addBypassRisk(BypassRisk risk) {
        bypassRisks.add(risk);
    }

    public void addInjectionRisk(InjectionRisk risk) {
        injectionRisks.add(risk);
    }

    /**
     * Number of vulnerabilities so far; rules use it to number their ids.
     */
    public int vulnerabilityCount() {
        return vulnerabilities.size();
    }

    public List<SecurityVulnerability> getVulnerabilities() {
        return Collections.unmodifiableList(vulnerabilities);
    }

    public List<BypassRisk> getBypassRisks() {
        return Collections.unmodifiableList(bypassRisks);
    }

    public List<InjectionRisk> getInjectionRisks() {
        return Collections.unmodifiableList(injectionRisks);
    }
}
