package org.carball.rlsguard.model.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A node of a parsed policy expression. Every node kind is a record implementing this
 * interface; analyses dispatch on the kind through {@link PolicyNodeVisitor} and walk the
 * tree through {@link PolicyTrees}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "nodeType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ComparisonNode.class, name = "comparison"),
        @JsonSubTypes.Type(value = LogicalNode.class, name = "logical"),
        @JsonSubTypes.Type(value = FunctionNode.class, name = "function"),
        @JsonSubTypes.Type(value = ColumnNode.class, name = "column"),
        @JsonSubTypes.Type(value = LiteralNode.class, name = "literal"),
        @JsonSubTypes.Type(value = SubqueryNode.class, name = "subquery")
})
public interface PolicyConditionNode {

    @JsonIgnore
    NodeType nodeType();

    /**
     * Direct children in evaluation order. Subquery nodes report none: their nested
     * condition is reachable only through {@link SubqueryNode#subquery()}.
     */
    @JsonIgnore
    List<PolicyConditionNode> children();

    <R> R accept(PolicyNodeVisitor<R> visitor);
}
