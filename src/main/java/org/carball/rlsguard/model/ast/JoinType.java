package org.carball.rlsguard.model.ast;

public enum JoinType {
    INNER(1),
    LEFT(2),
    RIGHT(2),
    FULL(3),
    CROSS(4);

    private final int weight;

    JoinType(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
