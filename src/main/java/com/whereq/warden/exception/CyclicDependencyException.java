package com.whereq.warden.exception;

import java.util.List;

/**
 * Thrown when a batch's dependency graph contains a cycle. The batch is never scheduled.
 */
public class CyclicDependencyException extends WardenException {

    private final List<String> cycles;

    public CyclicDependencyException(List<String> cycles) {
        super("Circular dependencies detected: " + String.join(", ", cycles));
        this.cycles = List.copyOf(cycles);
    }

    /**
     * Offending edges, formatted as {@code "from -> to"}
     */
    public List<String> getCycles() {
        return cycles;
    }
}
