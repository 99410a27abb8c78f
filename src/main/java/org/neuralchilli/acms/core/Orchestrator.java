package org.neuralchilli.acms.core;

import org.neuralchilli.acms.domain.ExecutionState;
import org.neuralchilli.acms.domain.Task;
import org.neuralchilli.acms.domain.TaskGraph;
import org.neuralchilli.acms.domain.TaskResult;
import org.neuralchilli.acms.domain.Wave;
import org.neuralchilli.acms.observability.Ledger;
import org.neuralchilli.acms.observability.NoOpTracer;
import org.neuralchilli.acms.observability.OrchestrationMonitor;
import org.neuralchilli.acms.observability.Tracer;
import org.neuralchilli.acms.plugin.HookFailedException;
import org.neuralchilli.acms.plugin.HookFailurePolicy;
import org.neuralchilli.acms.plugin.PluginRegistry;
import org.neuralchilli.acms.plugin.WorkflowPlugin;
import org.neuralchilli.acms.util.Ulids;
import org.neuralchilli.acms.worker.WorkerThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives a task graph to completion.
 *
 * <p>The scheduler's wave plan is executed wave by wave; every wave is a barrier. Inside
 * a wave tasks run in plan order, or on a bounded worker pool when parallelism is above 1.
 * A failing task is retried in place until its attempt budget runs out; an exhausted task
 * aborts the run, cancelling every task that has not started.
 *
 * <p>Each terminal transition (COMPLETED, exhausted FAILED, CANCELLED) is written to the
 * ledger and reported to {@code afterTask} hooks. One orchestrator serves any number of
 * runs; every run gets fresh execution records.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    public static final String WORKFLOW_STARTED = "workflow_started";
    public static final String TASK_TERMINAL = "task_terminal";
    public static final String WORKFLOW_FINISHED = "workflow_finished";

    private final TaskScheduler scheduler;
    private final Ledger ledger;
    private final Tracer tracer;
    private final PluginRegistry plugins;
    private final OrchestratorSettings settings;
    private final OrchestrationMonitor monitor;

    public Orchestrator(
            TaskScheduler scheduler,
            Ledger ledger,
            Tracer tracer,
            List<? extends WorkflowPlugin> plugins,
            OrchestratorSettings settings,
            OrchestrationMonitor monitor
    ) {
        if (scheduler == null) {
            throw new IllegalArgumentException("Scheduler cannot be null");
        }
        this.scheduler = scheduler;
        this.ledger = ledger != null ? ledger : Ledger.discarding();
        this.tracer = tracer != null ? tracer : NoOpTracer.INSTANCE;
        this.settings = settings != null ? settings : OrchestratorSettings.defaults();
        this.monitor = monitor != null ? monitor : new OrchestrationMonitor();
        this.plugins = new PluginRegistry(plugins, this.settings.hookFailurePolicy(), this.monitor);
    }

    public static Builder builder() {
        return new Builder();
    }

    public OrchestratorSettings settings() {
        return settings;
    }

    public List<WorkflowPlugin> plugins() {
        return plugins.plugins();
    }

    public OrchestrationMonitor monitor() {
        return monitor;
    }

    /**
     * Run a graph under a freshly generated run trace id.
     */
    public Map<String, TaskResult> run(TaskGraph graph, TaskExecutor executor) {
        return run(graph, executor, null);
    }

    /**
     * Run a graph to completion.
     *
     * @param traceId run trace id; a ULID is generated when null or blank
     * @return one result per task, in plan order
     * @throws org.neuralchilli.acms.service.CycleDetectedException if the graph has a cycle; nothing runs
     * @throws TaskFailedException    when a task exhausts its attempts
     * @throws HookFailedException    when a hook fails under {@link HookFailurePolicy#ABORT}
     */
    public Map<String, TaskResult> run(TaskGraph graph, TaskExecutor executor, String traceId) {
        return execute(prepare(graph, traceId), executor);
    }

    /**
     * Plan a graph and create the run's execution records without executing anything.
     * Cycle and validation errors surface here.
     */
    public WorkflowRun prepare(TaskGraph graph, String traceId) {
        if (graph == null) {
            throw new IllegalArgumentException("Task graph cannot be null");
        }
        String runTraceId = traceId == null || traceId.isBlank() ? Ulids.newUlid() : traceId;
        return new WorkflowRun(graph, runTraceId, scheduler.plan(graph));
    }

    /**
     * Execute a prepared run. A run can be executed only once.
     */
    public Map<String, TaskResult> execute(WorkflowRun run, TaskExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("Task executor cannot be null");
        }
        if (!run.markStarted()) {
            throw new IllegalStateException("Run " + run.traceId() + " has already been executed");
        }

        monitor.recordRunStarted();
        OrchestrationMonitor.Timer timer = monitor.startTimer("run");
        log.info("Starting run {} of graph '{}': {} tasks in {} waves",
                run.traceId(), run.graph().name(), run.plan().totalTasks(), run.plan().totalWaves());

        Map<String, Object> started = event(WORKFLOW_STARTED, run);
        started.put("graph", run.graph().name());
        started.put("total_tasks", run.plan().totalTasks());
        started.put("total_waves", run.plan().totalWaves());
        record(started);

        ExecutorService pool = settings.isSequential() || run.plan().maxParallelism() < 2
                ? null
                : Executors.newFixedThreadPool(settings.parallelism(), new WorkerThreadFactory("acms-" + run.traceId()));

        try (Tracer.Span span = tracer.startSpan("workflow.run",
                Map.of("run_trace_id", run.traceId(), "graph", run.graph().name()))) {
            try {
                plugins.beforeWorkflow(run.graph(), run.traceId());
                for (Wave wave : run.plan().waves()) {
                    Optional<TaskResult> failure = runWave(run, wave, executor, pool);
                    if (failure.isPresent()) {
                        TaskResult failed = failure.get();
                        abort(run, "task " + failed.taskId() + " exhausted " + failed.attempts() + " attempt(s)");
                        TaskFailedException error = new TaskFailedException(
                                failed.taskId(), failed.attempts(), failed.error(), run.results());
                        span.recordError(error);
                        throw error;
                    }
                }
            } catch (TaskFailedException e) {
                throw e;
            } catch (RuntimeException | Error e) {
                span.recordError(e);
                abort(run, e.toString());
                throw e;
            }

            Map<String, TaskResult> results = run.results();
            finish(run, "succeeded");
            try {
                plugins.afterWorkflow(results, run.traceId(), false);
            } catch (HookFailedException e) {
                span.recordError(e);
                monitor.recordRunAborted();
                throw e;
            }
            monitor.recordRunSucceeded();
            log.info("Run {} of graph '{}' completed: {} tasks", run.traceId(), run.graph().name(), results.size());
            return results;
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
            timer.stop();
        }
    }

    /**
     * Execute one wave. Returns the first exhausted task in wave order, if any.
     */
    private Optional<TaskResult> runWave(WorkflowRun run, Wave wave, TaskExecutor executor, ExecutorService pool) {
        run.currentWave(wave.index());
        OrchestrationMonitor.Timer timer = monitor.startTimer("wave");
        log.info("Run {}: wave {}/{} with {} task(s) {}",
                run.traceId(), wave.index(), run.plan().totalWaves(), wave.size(), wave.taskIds());

        try (Tracer.Span span = tracer.startSpan("workflow.wave",
                Map.of("run_trace_id", run.traceId(), "wave", String.valueOf(wave.index())))) {
            if (pool == null || !wave.canParallel()) {
                for (String taskId : wave.taskIds()) {
                    TaskResult result = driveTask(run, taskId, wave.index(), executor);
                    if (!result.isSuccess()) {
                        span.recordError(result.error());
                        return Optional.of(result);
                    }
                }
                return Optional.empty();
            }
            return runWaveInParallel(run, wave, executor, pool, span);
        } finally {
            timer.stop();
        }
    }

    private Optional<TaskResult> runWaveInParallel(
            WorkflowRun run,
            Wave wave,
            TaskExecutor executor,
            ExecutorService pool,
            Tracer.Span span
    ) {
        List<Future<TaskResult>> futures = new ArrayList<>(wave.size());
        for (String taskId : wave.taskIds()) {
            futures.add(pool.submit(() -> {
                if (run.isAborted()) {
                    return null;
                }
                try {
                    TaskResult result = driveTask(run, taskId, wave.index(), executor);
                    if (!result.isSuccess()) {
                        run.markAborted();
                    }
                    return result;
                } catch (RuntimeException | Error e) {
                    run.markAborted();
                    throw e;
                }
            }));
        }

        // barrier: every started task reaches a terminal outcome before the wave ends
        TaskResult firstFailure = null;
        Throwable firstError = null;
        for (Future<TaskResult> future : futures) {
            try {
                TaskResult result = future.get();
                if (result != null && !result.isSuccess() && firstFailure == null) {
                    firstFailure = result;
                }
            } catch (ExecutionException e) {
                if (firstError == null) {
                    if (e.getCause() instanceof Error error) {
                        firstError = error;
                    } else {
                        firstError = e.getCause() instanceof RuntimeException runtime
                                ? runtime
                                : new IllegalStateException("Task worker failed", e.getCause());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.markAborted();
                throw new IllegalStateException("Interrupted while waiting for wave " + wave.index(), e);
            }
        }

        if (firstError instanceof Error error) {
            throw error;
        }
        if (firstError != null) {
            throw (RuntimeException) firstError;
        }
        if (firstFailure != null) {
            span.recordError(firstFailure.error());
        }
        return Optional.ofNullable(firstFailure);
    }

    /**
     * Run one task through its attempts until it completes or its budget is spent.
     */
    private TaskResult driveTask(WorkflowRun run, String taskId, int waveIndex, TaskExecutor executor) {
        TaskStateMachine machine = run.stateMachine(taskId);
        TaskExecution execution = machine.execution();
        Task task = run.task(taskId);
        OrchestrationMonitor.Timer timer = monitor.startTimer("task");

        try {
            machine.ensureDependenciesSatisfied(run.completedTaskIds());

            while (true) {
                machine.start();
                monitor.recordTaskAttempt();

                Object output = null;
                Exception failure = null;
                try (Tracer.Span span = tracer.startSpan("task.attempt", Map.of(
                        "run_trace_id", run.traceId(),
                        "task_id", taskId,
                        "task_trace_id", execution.traceId(),
                        "attempt", String.valueOf(execution.attempt())))) {
                    try {
                        output = executor.execute(taskId, execution);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        failure = e;
                        span.recordError(e);
                    } catch (Exception e) {
                        failure = e;
                        span.recordError(e);
                    }
                }

                if (failure == null) {
                    machine.complete();
                    monitor.recordTaskCompleted();
                    TaskResult result = TaskResult.completed(taskId, execution.attempt(), execution.traceId(), output);
                    run.recordResult(result);
                    log.info("Task {} completed on attempt {}/{}", taskId, execution.attempt(), execution.maxAttempts());
                    onTerminal(run, task, machine, waveIndex, false);
                    return result;
                }

                machine.fail();
                if (machine.canTransitionTo(ExecutionState.PENDING)) {
                    log.warn("Task {} failed on attempt {}/{}, retrying: {}",
                            taskId, execution.attempt(), execution.maxAttempts(), failure.getMessage());
                    monitor.recordTaskRetry();
                    machine.reset();
                    continue;
                }

                monitor.recordTaskFailed();
                TaskResult result = TaskResult.failed(taskId, execution.attempt(), execution.traceId(), failure);
                run.recordResult(result);
                log.error("Task {} failed after {} attempt(s), aborting run {}",
                        taskId, execution.attempt(), run.traceId(), failure);
                onTerminal(run, task, machine, waveIndex, true);
                return result;
            }
        } finally {
            timer.stop();
        }
    }

    /**
     * Abort a run: cancel every task that can still be cancelled, close the ledger entry
     * for the run and fire {@code afterWorkflow}. Hook failures are only logged here.
     * A task left RUNNING (its executor threw an {@link Error}) is cancelled too.
     */
    private void abort(WorkflowRun run, String reason) {
        run.markAborted();
        log.error("Aborting run {} of graph '{}' in wave {}: {}",
                run.traceId(), run.graph().name(), run.currentWave(), reason);

        for (TaskStateMachine machine : run.stateMachines()) {
            boolean retryable = machine.state() == ExecutionState.FAILED && !machine.isExhausted();
            if (machine.state() != ExecutionState.PENDING
                    && machine.state() != ExecutionState.RUNNING
                    && !retryable) {
                continue;
            }
            TaskExecution execution = machine.execution();
            machine.cancel();
            monitor.recordTaskCancelled();
            run.recordResult(TaskResult.cancelled(execution.taskId(), execution.attempt(), execution.traceId()));
            log.debug("Task {} cancelled", execution.taskId());
            int waveIndex = run.plan().waveOf(execution.taskId()).orElse(0);
            onTerminal(run, run.task(execution.taskId()), machine, waveIndex, true);
        }

        finish(run, "aborted");
        plugins.afterWorkflow(run.results(), run.traceId(), true);
        monitor.recordRunAborted();
    }

    private void onTerminal(WorkflowRun run, Task task, TaskStateMachine machine, int waveIndex, boolean aborting) {
        TaskExecution execution = machine.execution();
        Map<String, Object> event = event(TASK_TERMINAL, run);
        event.put("task_id", execution.taskId());
        event.put("task_trace_id", execution.traceId());
        event.put("wave", waveIndex);
        event.put("state", machine.state().name());
        event.put("attempt", execution.attempt());
        event.put("max_attempts", execution.maxAttempts());
        event.put("exhausted", machine.isExhausted());
        run.result(execution.taskId())
                .flatMap(TaskResult::errorMessage)
                .ifPresent(message -> event.put("error", message));
        record(event);

        plugins.afterTask(task, execution, aborting);
    }

    private void finish(WorkflowRun run, String status) {
        Map<String, Object> event = event(WORKFLOW_FINISHED, run);
        event.put("status", status);
        Map<ExecutionState, Integer> counts = new LinkedHashMap<>();
        for (TaskResult result : run.results().values()) {
            counts.merge(result.state(), 1, Integer::sum);
        }
        event.put("completed", counts.getOrDefault(ExecutionState.COMPLETED, 0));
        event.put("failed", counts.getOrDefault(ExecutionState.FAILED, 0));
        event.put("cancelled", counts.getOrDefault(ExecutionState.CANCELLED, 0));
        record(event);
    }

    private static Map<String, Object> event(String type, WorkflowRun run) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(Ledger.EVENT_TYPE, type);
        event.put("run_trace_id", run.traceId());
        return event;
    }

    private void record(Map<String, Object> event) {
        try {
            ledger.record(event);
        } catch (RuntimeException e) {
            monitor.recordLedgerFailure();
            log.warn("Ledger rejected {} event: {}", event.get(Ledger.EVENT_TYPE), e.getMessage(), e);
        }
    }

    /**
     * Builder with in-process defaults: no ledger output, no tracing, no plugins,
     * sequential waves.
     */
    public static class Builder {
        private TaskScheduler scheduler = new TaskScheduler();
        private Ledger ledger = Ledger.discarding();
        private Tracer tracer = NoOpTracer.INSTANCE;
        private final List<WorkflowPlugin> plugins = new ArrayList<>();
        private int parallelism = 1;
        private HookFailurePolicy hookFailurePolicy = HookFailurePolicy.ABORT;
        private OrchestrationMonitor monitor;

        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder ledger(Ledger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder plugin(WorkflowPlugin plugin) {
            this.plugins.add(plugin);
            return this;
        }

        public Builder plugins(List<? extends WorkflowPlugin> plugins) {
            this.plugins.addAll(plugins);
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder hookFailurePolicy(HookFailurePolicy hookFailurePolicy) {
            this.hookFailurePolicy = hookFailurePolicy;
            return this;
        }

        public Builder settings(OrchestratorSettings settings) {
            this.parallelism = settings.parallelism();
            this.hookFailurePolicy = settings.hookFailurePolicy();
            return this;
        }

        public Builder monitor(OrchestrationMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Orchestrator build() {
            return new Orchestrator(
                    scheduler,
                    ledger,
                    tracer,
                    plugins,
                    new OrchestratorSettings(parallelism, hookFailurePolicy),
                    monitor
            );
        }
    }
}
