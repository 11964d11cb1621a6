package org.carball.rlsguard.model.ast;

import java.util.List;

public record FunctionNode(String functionName, List<PolicyConditionNode> arguments) implements PolicyConditionNode {

    public FunctionNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.FUNCTION;
    }

    @Override
    public List<PolicyConditionNode> children() {
        return arguments;
    }

    @Override
    public <R> R accept(PolicyNodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
