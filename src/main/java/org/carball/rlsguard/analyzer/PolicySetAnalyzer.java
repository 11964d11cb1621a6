package org.carball.rlsguard.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.rlsguard.config.AnalyzerConfig;
import org.carball.rlsguard.model.analysis.ComplexityLevel;
import org.carball.rlsguard.model.analysis.PerformanceImpact;
import org.carball.rlsguard.model.analysis.PolicyIssue;
import org.carball.rlsguard.model.analysis.SecurityStrength;
import org.carball.rlsguard.model.conflict.PolicyConflictReport;
import org.carball.rlsguard.model.policy.AnalyzedPolicy;
import org.carball.rlsguard.model.policy.ParsedPolicyCondition;
import org.carball.rlsguard.model.policy.PolicyDefinition;
import org.carball.rlsguard.model.policy.PolicySetReport;
import org.carball.rlsguard.parser.RlsPolicyParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Analyzes every policy of a set and runs conflict detection table by table.
 */
@Slf4j
public class PolicySetAnalyzer {

    static final String UNASSIGNED_TABLE = "<unassigned>";

    private final AnalyzerConfig config;
    private final RlsPolicyParser parser;
    private final ComplexityScorer complexityScorer;

    public PolicySetAnalyzer(AnalyzerConfig config) {
        this(config, new RlsPolicyParser(config));
    }

    public PolicySetAnalyzer(AnalyzerConfig config, RlsPolicyParser parser) {
        this.config = Objects.requireNonNull(config, "config");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.complexityScorer = new ComplexityScorer();

        log.info("Initialized PolicySetAnalyzer with config: {}", config.getConfigurationSummary());
    }

    public PolicySetReport analyze(List<PolicyDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        log.info("Starting analysis of {} RLS policies", definitions.size());

        Map<ComplexityLevel, Integer> complexity = zeroCounts(ComplexityLevel.class);
        Map<SecurityStrength, Integer> security = zeroCounts(SecurityStrength.class);
        Map<PerformanceImpact, Integer> performance = zeroCounts(PerformanceImpact.class);

        List<AnalyzedPolicy> policies = new ArrayList<>();
        Map<String, ParsedPolicyCondition> parsedByExpression = new ConcurrentHashMap<>();
        int analyzed = 0;
        for (PolicyDefinition definition : definitions) {
            AnalyzedPolicy policy = analyzePolicy(definition);
            policies.add(policy);

            if (policy.isAnalyzed()) {
                analyzed++;
                ParsedPolicyCondition parsed = policy.parsed();
                parsedByExpression.putIfAbsent(definition.expression().trim(), parsed);
                complexity.merge(parsed.getComplexity().level(), 1, Integer::sum);
                security.merge(parsed.getSecurity().getStrength(), 1, Integer::sum);
                performance.merge(parsed.getPerformance().getImpact(), 1, Integer::sum);
            }
        }

        PolicyConflictReport conflicts = config.isConflictDetectionEnabled()
                ? detectConflictsPerTable(definitions, parsedByExpression)
                : PolicyConflictReport.empty();

        PolicySetReport result = PolicySetReport.builder()
                .totalPolicies(definitions.size())
                .analyzedPolicies(analyzed)
                .policies(List.copyOf(policies))
                .complexityDistribution(Collections.unmodifiableMap(complexity))
                .securityDistribution(Collections.unmodifiableMap(security))
                .performanceDistribution(Collections.unmodifiableMap(performance))
                .conflictReport(conflicts)
                .build();

        log.info("Analysis complete. {} of {} policies analyzed, {} issues, {} conflicts, {} gaps",
                analyzed, definitions.size(), result.issueCount(),
                conflicts.getConflicts().size(), conflicts.getGaps().size());

        return result;
    }

    private AnalyzedPolicy analyzePolicy(PolicyDefinition definition) {
        String expression = definition.expression();
        if (expression == null || expression.isBlank()) {
            log.debug("Policy {} has no expression, skipping analysis", definition.name());
            return new AnalyzedPolicy(definition.name(), definition.table(), definition.command(),
                    definition.type(), null, List.of());
        }

        ParsedPolicyCondition parsed = parser.parsePolicy(expression);
        List<PolicyIssue> issues = parser.validatePolicyLogic(parsed);

        if (log.isDebugEnabled()) {
            log.debug("\n{}", complexityScorer.generateComplexityReport(definition.name(), parsed.getComplexity()));
        }

        return new AnalyzedPolicy(definition.name(), definition.table(), definition.command(),
                definition.type(), parsed, issues);
    }

    /**
     * Policies are grouped by table first; two policies on different tables never conflict.
     * Expressions already analyzed above are not parsed again.
     */
    private PolicyConflictReport detectConflictsPerTable(List<PolicyDefinition> definitions,
                                                         Map<String, ParsedPolicyCondition> parsedByExpression) {
        ConflictDetector detector = new ConflictDetector(
                expression -> parsedByExpression.computeIfAbsent(expression.trim(), parser::parsePolicy),
                config.isParallelConflictDetection());

        Map<String, List<PolicyDefinition>> byTable = new LinkedHashMap<>();
        for (PolicyDefinition definition : definitions) {
            String table = definition.table() == null || definition.table().isBlank()
                    ? UNASSIGNED_TABLE : definition.table();
            byTable.computeIfAbsent(table, key -> new ArrayList<>()).add(definition);
        }

        List<PolicyConflictReport> reports = new ArrayList<>();
        byTable.forEach((table, policies) -> {
            log.debug("Checking {} policies on table {} for conflicts", policies.size(), table);
            reports.add(detector.detectPolicyConflicts(policies));
        });

        return PolicyConflictReport.merge(reports);
    }

    private static <E extends Enum<E>> Map<E, Integer> zeroCounts(Class<E> type) {
        Map<E, Integer> counts = new EnumMap<>(type);
        for (E value : type.getEnumConstants()) {
            counts.put(value, 0);
        }
        return counts;
    }
}
