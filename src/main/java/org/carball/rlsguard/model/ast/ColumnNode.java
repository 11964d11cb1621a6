package org.carball.rlsguard.model.ast;

import java.util.List;

public record ColumnNode(String columnName) implements PolicyConditionNode {

    @Override
    public NodeType nodeType() {
        return NodeType.COLUMN;
    }

    @Override
    public List<PolicyConditionNode> children() {
        return List.of();
    }

    @Override
    public <R> R accept(PolicyNodeVisitor<R> visitor) {
        return visitor.visitColumn(this);
    }
}
