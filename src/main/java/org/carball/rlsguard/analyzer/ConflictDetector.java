package org.carball.rlsguard.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.rlsguard.model.analysis.Severity;
import org.carball.rlsguard.model.conflict.ConflictResolution;
import org.carball.rlsguard.model.conflict.ConflictType;
import org.carball.rlsguard.model.conflict.OverlapType;
import org.carball.rlsguard.model.conflict.PolicyConflict;
import org.carball.rlsguard.model.conflict.PolicyConflictReport;
import org.carball.rlsguard.model.conflict.PolicyGap;
import org.carball.rlsguard.model.conflict.PolicyOverlap;
import org.carball.rlsguard.model.conflict.RedundancyLevel;
import org.carball.rlsguard.model.conflict.ResolutionStrategy;
import org.carball.rlsguard.model.policy.ParsedPolicyCondition;
import org.carball.rlsguard.model.policy.PolicyCommand;
import org.carball.rlsguard.model.policy.PolicyDefinition;
import org.carball.rlsguard.model.policy.PolicyMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Pairwise comparison of the policies of one table. Every unordered pair whose commands
 * overlap is compared once; the set as a whole is then checked for a missing DELETE policy.
 */
@Slf4j
public class ConflictDetector {

    private final Function<String, ParsedPolicyCondition> parser;
    private final boolean parallel;

    /**
     * @param parser   turns an expression into its analysis; must not throw
     * @param parallel compare pairs on the common fork-join pool
     */
    public ConflictDetector(Function<String, ParsedPolicyCondition> parser, boolean parallel) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.parallel = parallel;
    }

    public PolicyConflictReport detectPolicyConflicts(List<PolicyDefinition> policies) {
        Objects.requireNonNull(policies, "policies");
        log.debug("Detecting conflicts across {} policies", policies.size());

        List<ParsedPolicy> parsed = policies.stream()
                .map(policy -> new ParsedPolicy(policy, parser.apply(expressionOf(policy))))
                .collect(Collectors.toList());

        IntStream indexes = IntStream.range(0, parsed.size());
        if (parallel) {
            indexes = indexes.parallel();
        }

        // Encounter order is kept by the ordered collect, so parallel runs report in the same order.
        List<PairResult> pairs = indexes.boxed()
                .flatMap(i -> IntStream.range(i + 1, parsed.size())
                        .mapToObj(j -> compare(parsed.get(i), parsed.get(j))))
                .collect(Collectors.toList());

        List<PolicyConflict> conflicts = new ArrayList<>();
        List<ConflictResolution> recommendations = new ArrayList<>();
        List<PolicyOverlap> overlaps = new ArrayList<>();
        for (PairResult pair : pairs) {
            pair.conflict().ifPresent(conflict -> {
                conflicts.add(conflict);
                recommendations.add(resolutionFor(conflict));
            });
            pair.overlap().ifPresent(overlaps::add);
        }

        PolicyConflictReport result = PolicyConflictReport.builder()
                .conflicts(List.copyOf(conflicts))
                .overlaps(List.copyOf(overlaps))
                .gaps(findDeleteGap(policies).map(List::of).orElse(List.of()))
                .recommendations(List.copyOf(recommendations))
                .build();
        log.debug("Found {} conflicts, {} overlaps and {} gaps",
                result.getConflicts().size(), result.getOverlaps().size(), result.getGaps().size());
        return result;
    }

    private PairResult compare(ParsedPolicy first, ParsedPolicy second) {
        PolicyDefinition p1 = first.definition();
        PolicyDefinition p2 = second.definition();

        if (!p1.command().overlaps(p2.command())) {
            return PairResult.NONE;
        }

        PolicyConflict conflict = null;
        if (isPermissiveRestrictivePair(p1, p2)) {
            conflict = new PolicyConflict(
                    "conflict-" + p1.name() + "-" + p2.name(),
                    Severity.MEDIUM,
                    ConflictType.CONTRADICTORY,
                    List.of(p1.name(), p2.name()),
                    "PERMISSIVE and RESTRICTIVE policies may interact unexpectedly",
                    "Users might have access when it should be restricted",
                    "Review policy interaction and ensure intended behavior");
        } else if (first.analysis().isFallback() || second.analysis().isFallback()) {
            conflict = new PolicyConflict(
                    "conflict-" + p1.name() + "-" + p2.name(),
                    Severity.LOW,
                    ConflictType.AMBIGUOUS,
                    List.of(p1.name(), p2.name()),
                    "Interaction cannot be determined because a policy expression failed to parse",
                    "Access decided by " + (first.analysis().isFallback() ? p1.name() : p2.name())
                            + " cannot be predicted",
                    "Fix the unparseable expression and re-run the analysis");
        }

        PolicyOverlap overlap = null;
        if (expressionOf(p1).equals(expressionOf(p2))) {
            overlap = new PolicyOverlap(
                    List.of(p1.name(), p2.name()),
                    OverlapType.IDENTICAL,
                    RedundancyLevel.COMPLETE,
                    "Remove one of the identical policies");
        }

        return new PairResult(Optional.ofNullable(conflict), Optional.ofNullable(overlap));
    }

    private static Optional<PolicyGap> findDeleteGap(List<PolicyDefinition> policies) {
        boolean deleteCovered = policies.stream()
                .anyMatch(p -> p.command() == PolicyCommand.DELETE || p.command() == PolicyCommand.ALL);
        if (deleteCovered) {
            return Optional.empty();
        }
        return Optional.of(new PolicyGap(
                "DELETE operations",
                Severity.MEDIUM,
                "No policy exists for DELETE operations",
                "CREATE POLICY delete_policy ON table_name FOR DELETE USING (user_id = auth.uid());"));
    }

    private static ConflictResolution resolutionFor(PolicyConflict conflict) {
        return new ConflictResolution(
                conflict.id(),
                ResolutionStrategy.REFACTOR,
                "Review and refactor conflicting policies",
                "Medium risk - ensure functionality is preserved");
    }

    /**
     * A blank USING clause is treated as {@code true}, which is what Postgres does when it
     * is omitted. Any other text is returned untouched, so overlap detection compares it
     * byte for byte.
     */
    static String expressionOf(PolicyDefinition policy) {
        String expression = policy.expression();
        return expression == null || expression.isBlank() ? "true" : expression;
    }

    static boolean isPermissiveRestrictivePair(PolicyDefinition p1, PolicyDefinition p2) {
        return (p1.type() == PolicyMode.PERMISSIVE && p2.type() == PolicyMode.RESTRICTIVE)
                || (p1.type() == PolicyMode.RESTRICTIVE && p2.type() == PolicyMode.PERMISSIVE);
    }

    private record ParsedPolicy(PolicyDefinition definition, ParsedPolicyCondition analysis) {
    }

    private record PairResult(Optional<PolicyConflict> conflict, Optional<PolicyOverlap> overlap) {
        static final PairResult NONE = new PairResult(Optional.empty(), Optional.empty());
    }
}
