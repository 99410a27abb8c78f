package org.neuralchilli.acms.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.acms.domain.ExecutionState;
import org.neuralchilli.acms.domain.Task;
import org.neuralchilli.acms.util.Ulids;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskStateMachineTest {

    private static TaskStateMachine machine(int maxAttempts) {
        return new TaskStateMachine(TaskExecution.create("task-b", maxAttempts, List.of("task-a")));
    }

    @Test
    void shouldStartPendingWithNoAttempts() {
        TaskStateMachine machine = machine(3);

        assertThat(machine.state()).isEqualTo(ExecutionState.PENDING);
        assertThat(machine.execution().attempt()).isZero();
        assertThat(machine.execution().remainingAttempts()).isEqualTo(3);
        assertThat(Ulids.isValid(machine.execution().traceId())).isTrue();
    }

    @Test
    void shouldCompleteOnFirstAttempt() {
        TaskStateMachine machine = machine(3);

        machine.start();
        machine.complete();

        assertThat(machine.state()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(machine.execution().attempt()).isEqualTo(1);
        assertThat(machine.execution().startedAt()).isNotNull();
        assertThat(machine.execution().finishedAt()).isNotNull();
        assertThat(machine.isFinished()).isTrue();
    }

    @Test
    void shouldRejectPendingToCompleted() {
        TaskStateMachine machine = machine(3);

        assertThatThrownBy(machine::complete)
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("PENDING to COMPLETED");
        assertThat(machine.state()).isEqualTo(ExecutionState.PENDING);
    }

    @Test
    void shouldEnforceRetryBudgetOfTwo() {
        TaskStateMachine machine = machine(2);

        machine.start();
        machine.fail();
        assertThat(machine.canTransitionTo(ExecutionState.PENDING)).isTrue();
        machine.reset();

        machine.start();
        machine.fail();
        assertThat(machine.execution().attempt()).isEqualTo(2);
        assertThat(machine.isExhausted()).isTrue();
        assertThat(machine.canTransitionTo(ExecutionState.PENDING)).isFalse();

        assertThatThrownBy(machine::reset)
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("cannot be retried");
        assertThat(machine.state()).isEqualTo(ExecutionState.FAILED);
    }

    @Test
    void shouldRefuseRunningOnceBudgetSpent() {
        TaskExecution execution = TaskExecution.create("x", 1, List.of());
        execution.incrementAttempt();
        TaskStateMachine machine = new TaskStateMachine(execution);

        assertThat(machine.canTransitionTo(ExecutionState.RUNNING)).isFalse();
        assertThatThrownBy(machine::start)
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("retry budget exhausted");
        assertThat(machine.state()).isEqualTo(ExecutionState.PENDING);
        assertThat(execution.attempt()).isEqualTo(1);
    }

    @Test
    void shouldKeepTraceIdAcrossRetries() {
        TaskStateMachine machine = machine(3);
        String traceId = machine.execution().traceId();

        machine.start();
        machine.fail();
        machine.reset();
        machine.start();
        machine.complete();

        assertThat(machine.execution().traceId()).isEqualTo(traceId);
        assertThat(machine.execution().attempt()).isEqualTo(2);
    }

    @Test
    void shouldCancelFromPendingAndFailed() {
        TaskStateMachine pending = machine(3);
        pending.cancel();
        assertThat(pending.state()).isEqualTo(ExecutionState.CANCELLED);

        TaskStateMachine failed = machine(1);
        failed.start();
        failed.fail();
        failed.cancel();
        assertThat(failed.state()).isEqualTo(ExecutionState.CANCELLED);
        assertThat(failed.isFinished()).isTrue();
    }

    @Test
    void shouldSkipOnlyFromPending() {
        TaskStateMachine machine = machine(3);
        machine.skip();
        assertThat(machine.state()).isEqualTo(ExecutionState.SKIPPED);

        TaskStateMachine running = machine(3);
        running.start();
        assertThatThrownBy(running::skip).isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void shouldNotLeaveTerminalStates() {
        TaskStateMachine machine = machine(3);
        machine.start();
        machine.complete();

        assertThatThrownBy(machine::start).isInstanceOf(IllegalTransitionException.class);
        assertThatThrownBy(machine::reset).isInstanceOf(IllegalTransitionException.class);
        assertThatThrownBy(machine::cancel).isInstanceOf(IllegalTransitionException.class);
        assertThat(machine.execution().attempt()).isEqualTo(1);
    }

    @Test
    void shouldReportUnmetDependencies() {
        TaskStateMachine machine = new TaskStateMachine(
                TaskExecution.create("d", 3, List.of("c", "b", "a")));

        assertThatThrownBy(() -> machine.ensureDependenciesSatisfied(Set.of("b")))
                .isInstanceOf(DependencyNotSatisfiedException.class)
                .hasMessage("Task d cannot run; unmet dependencies: a, c")
                .satisfies(e -> assertThat(((DependencyNotSatisfiedException) e).unmetDependencies())
                        .containsExactly("a", "c"));

        machine.ensureDependenciesSatisfied(Set.of("a", "b", "c"));
    }

    @Test
    void shouldSnapshotExecutionRecord() {
        Task task = Task.builder("load").dependsOn("extract").maxAttempts(4)
                .metadata("command", "echo").build();
        TaskStateMachine machine = new TaskStateMachine(TaskExecution.create(task));
        machine.start();

        Map<String, Object> snapshot = machine.snapshot();

        assertThat(snapshot)
                .containsEntry("task_id", "load")
                .containsEntry("state", "RUNNING")
                .containsEntry("attempt", 1)
                .containsEntry("max_attempts", 4)
                .containsEntry("dependencies", List.of("extract"))
                .containsEntry("metadata", Map.of("command", "echo"))
                .containsKey("trace_id");
    }
}
