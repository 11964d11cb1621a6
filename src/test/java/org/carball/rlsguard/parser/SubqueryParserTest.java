package org.carball.rlsguard.parser;

import org.carball.rlsguard.model.ast.ComparisonNode;
import org.carball.rlsguard.model.ast.JoinClause;
import org.carball.rlsguard.model.ast.JoinType;
import org.carball.rlsguard.model.ast.ParsedSubquery;
import org.carball.rlsguard.model.ast.SubqueryNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SubqueryParserTest {

    private SubqueryParser parser;

    @BeforeEach
    void setUp() {
        parser = new SubqueryParser(3);
    }

    @Test
    void shouldSplitSelectIntoParts() {
        // When
        SubqueryNode node = parser.parse("SELECT team_id FROM members WHERE user_id = auth.uid()", 0);

        // Then
        ParsedSubquery subquery = node.subquery();
        assertThat(subquery).isNotNull();
        assertThat(subquery.select()).containsExactly("team_id");
        assertThat(subquery.from()).containsExactly("members");
        assertThat(subquery.joins()).isEmpty();
        assertThat(subquery.where()).isInstanceOf(ComparisonNode.class);
        assertThat(subquery.potentialPerformanceIssues()).isEmpty();
        assertThat(subquery.complexity()).isEqualTo(3);
    }

    @Test
    void shouldDescribeExplicitJoins() {
        // When
        ParsedSubquery subquery = parser.parse(
                "SELECT 1 FROM members m JOIN teams t ON t.id = m.team_id WHERE m.user_id = auth.uid()", 0).subquery();

        // Then
        assertThat(subquery.joins()).hasSize(1);
        JoinClause join = subquery.joins().get(0);
        assertThat(join.type()).isEqualTo(JoinType.INNER);
        assertThat(join.table()).isEqualTo("teams t");
        assertThat(join.condition()).isEqualTo("t.id = m.team_id");
        assertThat(subquery.complexity()).isEqualTo(1 + 1 + 2);
    }

    @Test
    void shouldFlagCrossJoins() {
        // When
        ParsedSubquery subquery = parser.parse("SELECT 1 FROM a CROSS JOIN b WHERE a.x = 1", 0).subquery();

        // Then
        assertThat(subquery.joins()).extracting(JoinClause::type).containsExactly(JoinType.CROSS);
        assertThat(subquery.potentialPerformanceIssues())
                .anyMatch(issue -> issue.contains("CROSS JOIN with b"));
    }

    @Test
    void shouldFlagImplicitJoins() {
        // When
        ParsedSubquery subquery = parser.parse("SELECT 1 FROM a, b WHERE a.id = b.id", 0).subquery();

        // Then
        assertThat(subquery.from()).containsExactly("a", "b");
        assertThat(subquery.potentialPerformanceIssues())
                .anyMatch(issue -> issue.contains("Implicit join across 2 tables"));
    }

    @Test
    void shouldFlagMissingWhereAndSelectStar() {
        // When
        ParsedSubquery subquery = parser.parse("SELECT * FROM members", 0).subquery();

        // Then
        assertThat(subquery.where()).isNull();
        assertThat(subquery.potentialPerformanceIssues())
                .anyMatch(issue -> issue.contains("no WHERE clause"))
                .anyMatch(issue -> issue.contains("SELECT *"));
    }

    @Test
    void shouldNotFlagMissingWhereWhenNoTableIsRead() {
        // When
        ParsedSubquery subquery = parser.parse("SELECT auth.uid() AS uid", 0).subquery();

        // Then
        assertThat(subquery).isNotNull();
        assertThat(subquery.from()).isEmpty();
        assertThat(subquery.where()).isNull();
        assertThat(subquery.potentialPerformanceIssues()).isEmpty();
    }

    @Test
    void shouldStopParsingWhereBeyondMaxDepth() {
        // Given
        SubqueryParser shallow = new SubqueryParser(0);

        // When
        ParsedSubquery subquery = shallow.parse("SELECT team_id FROM members WHERE user_id = auth.uid()", 0).subquery();

        // Then
        assertThat(subquery.where()).isNull();
        assertThat(subquery.potentialPerformanceIssues())
                .anyMatch(issue -> issue.contains("nested deeper than 0 levels"));
    }

    @Test
    void shouldKeepRawTextWhenSelectCannotBeSplit() {
        // When
        SubqueryNode node = parser.parse("SELECT FROM WHERE ((", 0);

        // Then
        assertThat(node.sql()).isEqualTo("SELECT FROM WHERE ((");
        assertThat(node.subquery()).isNull();
    }
}
