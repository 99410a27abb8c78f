package org.neuralchilli.acms.core;

import org.neuralchilli.acms.domain.TaskResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a task exhausts its retry budget and the run is aborted.
 * Carries the results collected before the abort, including the cancelled tasks.
 */
public class TaskFailedException extends RuntimeException {

    private final String taskId;
    private final int attempts;
    private final Map<String, TaskResult> partialResults;

    public TaskFailedException(String taskId, int attempts, Throwable cause, Map<String, TaskResult> partialResults) {
        super("Task " + taskId + " failed after " + attempts + " attempt(s)" +
                (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.taskId = taskId;
        this.attempts = attempts;
        this.partialResults = partialResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(partialResults))
                : Map.of();
    }

    public String taskId() {
        return taskId;
    }

    public int attempts() {
        return attempts;
    }

    public Map<String, TaskResult> partialResults() {
        return partialResults;
    }
}
