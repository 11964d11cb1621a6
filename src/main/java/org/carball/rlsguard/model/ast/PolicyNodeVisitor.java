package org.carball.rlsguard.model.ast;

public interface PolicyNodeVisitor<R> {

    R visitComparison(ComparisonNode node);

    R visitLogical(LogicalNode node);

    R visitFunction(FunctionNode node);

    R visitColumn(ColumnNode node);

    R visitLiteral(LiteralNode node);

    R visitSubquery(SubqueryNode node);
}
