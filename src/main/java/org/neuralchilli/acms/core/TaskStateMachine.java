package org.neuralchilli.acms.core;

import org.neuralchilli.acms.domain.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.neuralchilli.acms.domain.ExecutionState.CANCELLED;
import static org.neuralchilli.acms.domain.ExecutionState.COMPLETED;
import static org.neuralchilli.acms.domain.ExecutionState.FAILED;
import static org.neuralchilli.acms.domain.ExecutionState.PENDING;
import static org.neuralchilli.acms.domain.ExecutionState.RUNNING;
import static org.neuralchilli.acms.domain.ExecutionState.SKIPPED;

/**
 * Drives one {@link TaskExecution} through the execution lifecycle.
 *
 * <p>Composes a generic {@link StateMachine} with the retry budget:
 * <ul>
 *   <li>entering RUNNING consumes an attempt, and is itself refused once
 *       {@code attempt == maxAttempts}</li>
 *   <li>FAILED may only go back to PENDING while attempts remain; after that the
 *       only exit is CANCELLED</li>
 * </ul>
 */
public final class TaskStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskStateMachine.class);

    /**
     * Allowed transitions between execution states.
     */
    public static final TransitionTable<ExecutionState> TRANSITIONS =
            TransitionTable.builder(ExecutionState.class)
                    .allow(PENDING, RUNNING, SKIPPED, CANCELLED)
                    .allow(RUNNING, COMPLETED, FAILED, CANCELLED)
                    .allow(FAILED, PENDING, CANCELLED)
                    .build();

    private final TaskExecution execution;
    private final StateMachine<ExecutionState> machine;

    public TaskStateMachine(TaskExecution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("Task execution cannot be null");
        }
        this.execution = execution;
        this.machine = new StateMachine<>(TRANSITIONS, execution.state());
    }

    public TaskExecution execution() {
        return execution;
    }

    public ExecutionState state() {
        return machine.state();
    }

    /**
     * Check a move against both the transition table and the retry budget.
     */
    public boolean canTransitionTo(ExecutionState target) {
        if (!machine.canTransition(target)) {
            return false;
        }
        if (target == RUNNING || (state() == FAILED && target == PENDING)) {
            return execution.attempt() < execution.maxAttempts();
        }
        return true;
    }

    /**
     * PENDING -> RUNNING, consuming one attempt.
     *
     * @throws IllegalTransitionException if not PENDING or the retry budget is exhausted
     */
    public void start() {
        if (machine.canTransition(RUNNING) && execution.attempt() >= execution.maxAttempts()) {
            throw new IllegalTransitionException(state(), RUNNING,
                    "Task " + execution.taskId() + " retry budget exhausted (" +
                            execution.attempt() + "/" + execution.maxAttempts() + " attempts used)");
        }
        if (machine.canTransition(RUNNING)) {
            execution.incrementAttempt();
        }
        apply(RUNNING);
    }

    /**
     * RUNNING -> COMPLETED.
     */
    public void complete() {
        apply(COMPLETED);
    }

    /**
     * RUNNING -> FAILED.
     */
    public void fail() {
        apply(FAILED);
    }

    /**
     * FAILED -> PENDING so the task can be attempted again.
     *
     * @throws IllegalTransitionException if not FAILED or no attempts remain
     */
    public void reset() {
        if (state() == FAILED && execution.attempt() >= execution.maxAttempts()) {
            throw new IllegalTransitionException(FAILED, PENDING,
                    "Task " + execution.taskId() + " cannot be retried; all " +
                            execution.maxAttempts() + " attempts used");
        }
        apply(PENDING);
    }

    /**
     * PENDING, RUNNING or FAILED -> CANCELLED.
     */
    public void cancel() {
        apply(CANCELLED);
    }

    /**
     * PENDING -> SKIPPED.
     */
    public void skip() {
        apply(SKIPPED);
    }

    /**
     * Failed with no attempts left; the caller must treat the task as a terminal failure.
     */
    public boolean isExhausted() {
        return state() == FAILED && execution.attempt() >= execution.maxAttempts();
    }

    /**
     * Finished for the purposes of a run: a terminal state or an exhausted failure.
     */
    public boolean isFinished() {
        return state().isTerminal() || isExhausted();
    }

    /**
     * Validate that every dependency of the task appears in {@code completedTaskIds}.
     *
     * @throws DependencyNotSatisfiedException listing the unmet dependencies, sorted
     */
    public void ensureDependenciesSatisfied(Collection<String> completedTaskIds) {
        Set<String> completed = new HashSet<>(completedTaskIds);
        List<String> unmet = execution.dependencies().stream()
                .filter(dependency -> !completed.contains(dependency))
                .sorted()
                .toList();
        if (!unmet.isEmpty()) {
            throw new DependencyNotSatisfiedException(execution.taskId(), unmet);
        }
    }

    /**
     * Serialisable view of the execution record.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("task_id", execution.taskId());
        snapshot.put("state", state().name());
        snapshot.put("trace_id", execution.traceId());
        snapshot.put("attempt", execution.attempt());
        snapshot.put("max_attempts", execution.maxAttempts());
        snapshot.put("dependencies", List.copyOf(execution.dependencies()));
        snapshot.put("metadata", new LinkedHashMap<>(execution.metadata()));
        return snapshot;
    }

    private void apply(ExecutionState target) {
        ExecutionState from = state();
        if (!machine.canTransition(target)) {
            throw new IllegalTransitionException(from, target,
                    "Invalid transition from " + from + " to " + target + " for task " + execution.taskId());
        }
        machine.transition(target);
        execution.state(target);
        log.debug("Task {} {} -> {} (attempt {}/{})",
                execution.taskId(), from, target, execution.attempt(), execution.maxAttempts());
    }

    @Override
    public String toString() {
        return "TaskStateMachine[" + execution + ']';
    }
}
