package org.carball.rlsguard.model.ast;

import java.util.List;

/**
 * A {@code (SELECT ...)} operand. {@code subquery} is null when the SELECT text could not
 * be split into its parts.
 */
public record SubqueryNode(String sql, ParsedSubquery subquery) implements PolicyConditionNode {

    @Override
    public NodeType nodeType() {
        return NodeType.SUBQUERY;
    }

    @Override
    public List<PolicyConditionNode> children() {
        return List.of();
    }

    @Override
    public <R> R accept(PolicyNodeVisitor<R> visitor) {
        return visitor.visitSubquery(this);
    }
}
