package com.intervista.core.model;

/**
 * Dispatch priority of a task. Higher {@link #rank()} is dispatched first.
 */
public enum TaskPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
