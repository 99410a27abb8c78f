package org.neuralchilli.acms.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.acms.config.TaskGraphParser;
import org.neuralchilli.acms.core.Orchestrator;
import org.neuralchilli.acms.core.TaskExecutor;
import org.neuralchilli.acms.core.TaskScheduler;
import org.neuralchilli.acms.domain.DagStatistics;
import org.neuralchilli.acms.domain.TaskGraph;
import org.neuralchilli.acms.domain.TaskResult;
import org.neuralchilli.acms.domain.WavePlan;
import org.neuralchilli.acms.worker.CommandTaskExecutor;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point for planning and running graphs inside the application.
 * Graphs run with the command executor unless another executor is supplied.
 */
@ApplicationScoped
public class WorkflowService {

    @Inject
    Orchestrator orchestrator;

    @Inject
    TaskScheduler scheduler;

    @Inject
    TaskGraphParser parser;

    @Inject
    GraphLoaderService graphLoader;

    @Inject
    CommandTaskExecutor commandExecutor;

    public WavePlan plan(TaskGraph graph) {
        return scheduler.plan(graph);
    }

    public DagStatistics statistics(TaskGraph graph) {
        return scheduler.statistics(graph);
    }

    public Map<String, TaskResult> run(TaskGraph graph, String traceId) {
        return orchestrator.run(graph, commandExecutor, traceId);
    }

    public Map<String, TaskResult> run(TaskGraph graph, TaskExecutor executor, String traceId) {
        return orchestrator.run(graph, executor, traceId);
    }

    public Map<String, TaskResult> runFile(Path path, String traceId) {
        return run(parser.parse(path), traceId);
    }

    /**
     * Run a graph previously loaded by {@link GraphLoaderService}.
     *
     * @throws IllegalArgumentException if no graph with that name is loaded
     */
    public Map<String, TaskResult> runNamed(String name, String traceId) {
        TaskGraph graph = graphLoader.getGraph(name)
                .orElseThrow(() -> new IllegalArgumentException("No graph loaded with name: " + name));
        return run(graph, traceId);
    }
}
