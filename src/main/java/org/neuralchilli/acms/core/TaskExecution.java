package org.neuralchilli.acms.core;

import org.neuralchilli.acms.domain.ExecutionState;
import org.neuralchilli.acms.domain.Task;
import org.neuralchilli.acms.util.Ulids;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable execution record of one task within one run.
 * State and attempt count only change through {@link TaskStateMachine}; the trace id is
 * minted once at creation and is shared by every attempt of the task.
 */
public final class TaskExecution {

    private final String taskId;
    private final String traceId;
    private final int maxAttempts;
    private final List<String> dependencies;
    private final Map<String, Object> metadata;

    private ExecutionState state;
    private int attempt;
    private Instant startedAt;
    private Instant finishedAt;

    TaskExecution(
            String taskId,
            String traceId,
            ExecutionState initialState,
            int maxAttempts,
            List<String> dependencies,
            Map<String, Object> metadata
    ) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("Trace id cannot be null or empty");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("Initial state cannot be null");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be >= 1");
        }

        this.taskId = taskId;
        this.traceId = traceId;
        this.state = initialState;
        this.attempt = 0;
        this.maxAttempts = maxAttempts;
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Create a fresh PENDING record for a task, generating its trace id.
     */
    public static TaskExecution create(Task task) {
        return new TaskExecution(
                task.id(),
                Ulids.newUlid(),
                ExecutionState.PENDING,
                task.maxAttempts(),
                List.copyOf(task.dependencies()),
                task.metadata()
        );
    }

    /**
     * Create a PENDING record without a task definition.
     */
    public static TaskExecution create(String taskId, int maxAttempts, List<String> dependencies) {
        return new TaskExecution(
                taskId,
                Ulids.newUlid(),
                ExecutionState.PENDING,
                maxAttempts,
                dependencies,
                Map.of()
        );
    }

    public String taskId() {
        return taskId;
    }

    public String traceId() {
        return traceId;
    }

    public ExecutionState state() {
        return state;
    }

    /**
     * Number of times this task has entered RUNNING.
     */
    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public int remainingAttempts() {
        return Math.max(0, maxAttempts - attempt);
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    public boolean isFinished() {
        return state.isTerminal();
    }

    void state(ExecutionState newState) {
        this.state = newState;
        if (newState == ExecutionState.RUNNING) {
            this.startedAt = Instant.now();
            this.finishedAt = null;
        } else if (newState != ExecutionState.PENDING) {
            this.finishedAt = Instant.now();
        }
    }

    void incrementAttempt() {
        this.attempt++;
    }

    @Override
    public String toString() {
        return "TaskExecution[" +
                "taskId=" + taskId + ", " +
                "state=" + state + ", " +
                "attempt=" + attempt + "/" + maxAttempts + ", " +
                "traceId=" + traceId + ']';
    }
}
