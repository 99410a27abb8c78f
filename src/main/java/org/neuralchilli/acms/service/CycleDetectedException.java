package org.neuralchilli.acms.service;

import java.util.List;

/**
 * Thrown when a task graph contains a cycle.
 * Extends RuntimeException as this is a validation error that should
 * be caught before a run starts, not during execution.
 */
public class CycleDetectedException extends RuntimeException {

    private final List<String> taskIds;

    public CycleDetectedException(String message) {
        this(message, List.of());
    }

    public CycleDetectedException(String message, List<String> taskIds) {
        super(message);
        this.taskIds = List.copyOf(taskIds);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
        this.taskIds = List.of();
    }

    /**
     * Task ids found on a cycle, sorted; empty when unknown.
     */
    public List<String> taskIds() {
        return taskIds;
    }
}
