package com.intervista.core.state;

import java.util.List;

/**
 * Thrown when adding tasks would make the dependency graph cyclic. Nothing is inserted.
 */
public class CyclicDependencyException extends RuntimeException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Task ids along the cycle, first and last element equal. */
    public List<String> getCycle() {
        return cycle;
    }
}
