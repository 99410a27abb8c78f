package org.neuralchilli.acms.core;

import java.util.List;

/**
 * Thrown when a task is about to start while some of its dependencies have not completed.
 * The scheduler makes this unreachable, so seeing it means the plan was violated.
 */
public class DependencyNotSatisfiedException extends RuntimeException {

    private final String taskId;
    private final List<String> unmetDependencies;

    public DependencyNotSatisfiedException(String taskId, List<String> unmetDependencies) {
        super("Task " + taskId + " cannot run; unmet dependencies: " + String.join(", ", unmetDependencies));
        this.taskId = taskId;
        this.unmetDependencies = List.copyOf(unmetDependencies);
    }

    public String taskId() {
        return taskId;
    }

    public List<String> unmetDependencies() {
        return unmetDependencies;
    }
}
