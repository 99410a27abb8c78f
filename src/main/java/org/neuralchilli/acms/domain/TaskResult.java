package org.neuralchilli.acms.domain;

import java.util.Optional;

/**
 * Outcome of one task within a run.
 *
 * @param taskId   task identifier
 * @param state    final state reached during the run
 * @param attempts number of attempts consumed
 * @param traceId  trace id shared by every attempt of the task
 * @param output   value returned by the executor, null unless completed
 * @param error    last executor failure, null unless failed
 */
public record TaskResult(
        String taskId,
        ExecutionState state,
        int attempts,
        String traceId,
        Object output,
        Throwable error
) {
    public TaskResult {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative");
        }
    }

    public static TaskResult completed(String taskId, int attempts, String traceId, Object output) {
        return new TaskResult(taskId, ExecutionState.COMPLETED, attempts, traceId, output, null);
    }

    public static TaskResult failed(String taskId, int attempts, String traceId, Throwable error) {
        return new TaskResult(taskId, ExecutionState.FAILED, attempts, traceId, null, error);
    }

    public static TaskResult cancelled(String taskId, int attempts, String traceId) {
        return new TaskResult(taskId, ExecutionState.CANCELLED, attempts, traceId, null, null);
    }

    public boolean isSuccess() {
        return state == ExecutionState.COMPLETED;
    }

    public Optional<Object> outputValue() {
        return Optional.ofNullable(output);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error).map(Throwable::getMessage);
    }
}
