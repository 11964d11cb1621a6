package org.carball.rlsguard.model.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A constant. {@code value} is a {@link String} with the quotes removed, a {@link Long} or
 * {@link java.math.BigInteger}, a {@link Boolean}, null, or a {@link List} of those for an
 * {@code IN (...)} list.
 */
public record LiteralNode(LiteralKind kind, Object value) implements PolicyConditionNode {

    public static LiteralNode ofString(String value) {
        return new LiteralNode(LiteralKind.STRING, value);
    }

    public static LiteralNode ofNumber(Number value) {
        return new LiteralNode(LiteralKind.NUMBER, value);
    }

    public static LiteralNode ofBoolean(boolean value) {
        return new LiteralNode(LiteralKind.BOOLEAN, value);
    }

    public static LiteralNode ofNull() {
        return new LiteralNode(LiteralKind.NULL, null);
    }

    public static LiteralNode ofList(List<Object> values) {
        // elements may be null, so List.copyOf is not an option
        return new LiteralNode(LiteralKind.LIST, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    @JsonIgnore
    public boolean isTrue() {
        return kind == LiteralKind.BOOLEAN && Boolean.TRUE.equals(value);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.LITERAL;
    }

    @Override
    public List<PolicyConditionNode> children() {
        return List.of();
    }

    @Override
    public <R> R accept(PolicyNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
