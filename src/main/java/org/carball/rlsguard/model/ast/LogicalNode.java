package org.carball.rlsguard.model.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * AND/OR join two operands; NOT carries its operand in {@code right} and leaves
 * {@code left} null.
 */
public record LogicalNode(LogicalOperator operator,
                          PolicyConditionNode left,
                          PolicyConditionNode right) implements PolicyConditionNode {

    public static LogicalNode not(PolicyConditionNode operand) {
        return new LogicalNode(LogicalOperator.NOT, null, operand);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.LOGICAL;
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
        return visitor.visitLogical(this);
    }
}
