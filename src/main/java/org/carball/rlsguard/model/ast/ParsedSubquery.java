package org.carball.rlsguard.model.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Shallow view of a subquery: select and from items stay raw text, only the WHERE clause
 * is parsed into a condition tree.
 */
public record ParsedSubquery(
        List<String> select,
        List<String> from,
        PolicyConditionNode where,
        List<JoinClause> joins,
        int complexity,
        @JsonProperty("potentialPerformanceIssues") List<String> potentialPerformanceIssues
) {

    public ParsedSubquery {
        select = List.copyOf(select);
        from = List.copyOf(from);
        joins = List.copyOf(joins);
        potentialPerformanceIssues = List.copyOf(potentialPerformanceIssues);
    }
}
