package org.carball.rlsguard.model.ast;

public enum LogicalOperator {
    AND,
    OR,
    NOT
}
