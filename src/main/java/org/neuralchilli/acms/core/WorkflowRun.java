package org.neuralchilli.acms.core;

import org.neuralchilli.acms.domain.ExecutionState;
import org.neuralchilli.acms.domain.Task;
import org.neuralchilli.acms.domain.TaskGraph;
import org.neuralchilli.acms.domain.TaskResult;
import org.neuralchilli.acms.domain.WavePlan;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one orchestration run: the plan, a fresh execution record and state machine
 * per task, and the results gathered so far.
 *
 * <p>A run is executed at most once. Each task's state machine is driven by a single
 * thread at a time; the result and completed-set views are safe to read concurrently.
 */
public final class WorkflowRun {

    private final TaskGraph graph;
    private final String traceId;
    private final WavePlan plan;
    private final Map<String, TaskStateMachine> machines;
    private final Map<String, TaskResult> results = new ConcurrentHashMap<>();
    private final Set<String> completed = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Instant createdAt = Instant.now();

    private volatile int currentWave;
    private volatile boolean aborted;

    WorkflowRun(TaskGraph graph, String traceId, WavePlan plan) {
        this.graph = graph;
        this.traceId = traceId;
        this.plan = plan;

        Map<String, TaskStateMachine> byId = new LinkedHashMap<>();
        for (String taskId : plan.flatten()) {
            byId.put(taskId, new TaskStateMachine(TaskExecution.create(graph.task(taskId))));
        }
        this.machines = Collections.unmodifiableMap(byId);
    }

    public TaskGraph graph() {
        return graph;
    }

    public String traceId() {
        return traceId;
    }

    public WavePlan plan() {
        return plan;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * 1-based index of the wave being executed, 0 before the first wave.
     */
    public int currentWave() {
        return currentWave;
    }

    public boolean isAborted() {
        return aborted;
    }

    public TaskExecution execution(String taskId) {
        return stateMachine(taskId).execution();
    }

    public ExecutionState state(String taskId) {
        return stateMachine(taskId).state();
    }

    public Set<String> completedTaskIds() {
        return Collections.unmodifiableSet(completed);
    }

    /**
     * Results recorded so far, in plan order.
     */
    public Map<String, TaskResult> results() {
        Map<String, TaskResult> ordered = new LinkedHashMap<>();
        for (String taskId : machines.keySet()) {
            TaskResult result = results.get(taskId);
            if (result != null) {
                ordered.put(taskId, result);
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    public Optional<TaskResult> result(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    /**
     * Serialisable view of the run and every task's execution record.
     */
    public Map<String, Object> snapshot() {
        List<Map<String, Object>> tasks = new ArrayList<>();
        for (TaskStateMachine machine : machines.values()) {
            tasks.add(machine.snapshot());
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("run_trace_id", traceId);
        snapshot.put("graph", graph.name());
        snapshot.put("current_wave", currentWave);
        snapshot.put("total_waves", plan.totalWaves());
        snapshot.put("aborted", aborted);
        snapshot.put("tasks", tasks);
        return snapshot;
    }

    TaskStateMachine stateMachine(String taskId) {
        TaskStateMachine machine = machines.get(taskId);
        if (machine == null) {
            throw new IllegalArgumentException("Unknown task in run " + traceId + ": " + taskId);
        }
        return machine;
    }

    Task task(String taskId) {
        return graph.task(taskId);
    }

    Iterable<TaskStateMachine> stateMachines() {
        return machines.values();
    }

    boolean markStarted() {
        return started.compareAndSet(false, true);
    }

    void currentWave(int index) {
        this.currentWave = index;
    }

    void markAborted() {
        this.aborted = true;
    }

    void recordResult(TaskResult result) {
        results.put(result.taskId(), result);
        if (result.isSuccess()) {
            completed.add(result.taskId());
        }
    }

    @Override
    public String toString() {
        return "WorkflowRun[graph=" + graph.name() + ", traceId=" + traceId +
                ", wave=" + currentWave + "/" + plan.totalWaves() + ", aborted=" + aborted + ']';
    }
}
