package org.carball.rlsguard.model.ast;

public record JoinClause(JoinType type, String table, String condition, int complexity) {
}
