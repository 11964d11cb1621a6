package org.carball.rlsguard.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import org.carball.rlsguard.model.ast.JoinClause;
import org.carball.rlsguard.model.ast.JoinType;
import org.carball.rlsguard.model.ast.ParsedSubquery;
import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.model.ast.PolicyTrees;
import org.carball.rlsguard.model.ast.SubqueryNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Splits the SELECT of a subquery operand into raw select items, from items and joins.
 * Only the WHERE clause is parsed further, with the policy grammar, and only down to
 * {@code maxDepth} levels of nesting.
 */
@Slf4j
public class SubqueryParser {

    private final int maxDepth;

    public SubqueryParser(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * @param sql   the text between the parentheses, starting with SELECT
     * @param depth nesting depth of the expression the subquery appears in
     */
    public SubqueryNode parse(String sql, int depth) {
        ParsedSubquery parsed = null;

        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            if (statement instanceof Select select && select.getSelectBody() instanceof PlainSelect plainSelect) {
                parsed = describe(plainSelect, depth + 1);
            } else {
                log.debug("Subquery is not a plain SELECT, keeping raw text: {}", sql);
            }
        } catch (JSQLParserException e) {
            log.debug("Could not split subquery '{}': {}", sql, e.getMessage());
        }

        return new SubqueryNode(sql, parsed);
    }

    private ParsedSubquery describe(PlainSelect plainSelect, int nestedDepth) {
        List<String> select = plainSelect.getSelectItems() == null ? List.of() :
                plainSelect.getSelectItems().stream().map(Object::toString).collect(Collectors.toList());

        List<String> from = new ArrayList<>();
        if (plainSelect.getFromItem() != null) {
            from.add(plainSelect.getFromItem().toString());
        }

        List<JoinClause> joins = new ArrayList<>();
        if (plainSelect.getJoins() != null) {
            for (Join join : plainSelect.getJoins()) {
                if (join.isSimple()) {
                    // FROM a, b
                    from.add(join.getRightItem().toString());
                } else {
                    JoinType type = joinType(join);
                    joins.add(new JoinClause(type, join.getRightItem().toString(), joinCondition(join), type.getWeight()));
                }
            }
        }

        List<String> issues = new ArrayList<>();
        PolicyConditionNode where = null;
        Expression whereExpression = plainSelect.getWhere();

        if (whereExpression == null) {
            // SELECT auth.uid() reads no table at all
            if (!from.isEmpty()) {
                issues.add("Subquery has no WHERE clause and reads every row of " + String.join(", ", from));
            }
        } else if (nestedDepth > maxDepth) {
            issues.add("Subquery nested deeper than " + maxDepth + " levels; WHERE clause not analyzed");
        } else {
            String whereText = whereExpression.toString();
            try {
                where = PolicyExpressionParser.parse(whereText, this, nestedDepth);
            } catch (PolicyParseException e) {
                log.debug("Subquery WHERE clause not parsed: {}", e.getMessage());
                issues.add("Subquery WHERE clause could not be analyzed: " + e.getMessage());
            }
        }

        if (from.size() > 1) {
            issues.add("Implicit join across " + from.size() + " tables in FROM list");
        }
        for (JoinClause join : joins) {
            if (join.type() == JoinType.CROSS) {
                issues.add("CROSS JOIN with " + join.table() + " produces a cartesian product");
            }
        }
        if (select.stream().anyMatch(item -> item.trim().endsWith("*"))) {
            issues.add("SELECT * in subquery fetches columns the policy does not use");
        }

        int complexity = from.size()
                + joins.stream().mapToInt(JoinClause::complexity).sum()
                + PolicyTrees.depth(where);

        return new ParsedSubquery(select, from, where, joins, complexity, issues);
    }

    private static JoinType joinType(Join join) {
        if (join.isCross()) {
            return JoinType.CROSS;
        } else if (join.isFull()) {
            return JoinType.FULL;
        } else if (join.isLeft()) {
            return JoinType.LEFT;
        } else if (join.isRight()) {
            return JoinType.RIGHT;
        }
        return JoinType.INNER;
    }

    private static String joinCondition(Join join) {
        Collection<Expression> onExpressions = join.getOnExpressions();
        if (onExpressions != null && !onExpressions.isEmpty()) {
            return onExpressions.stream().map(Object::toString).collect(Collectors.joining(" AND "));
        }
        if (join.getUsingColumns() != null && !join.getUsingColumns().isEmpty()) {
            return "USING (" + join.getUsingColumns().stream().map(Object::toString)
                    .collect(Collectors.joining(", ")) + ")";
        }
        return "";
    }
}
