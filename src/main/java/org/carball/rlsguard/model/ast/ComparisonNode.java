package org.carball.rlsguard.model.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code left operator right}; {@code right} is null for {@code IS [NOT] NULL}.
 */
public record ComparisonNode(ComparisonOperator operator,
                             PolicyConditionNode left,
                             PolicyConditionNode right) implements PolicyConditionNode {

    @Override
    public NodeType nodeType() {
        return NodeType.COMPARISON;
    }

    @Override
    public List<PolicyConditionNode> children() {
        List<PolicyConditionNode> children = new ArrayList<>(2);
        if (left != null) {
            children.add(left);
        }
        if (right != null) {
            children.add(right);
        }
        return children;
    }

    @Override
    public <R> R accept(PolicyNodeVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }
}
