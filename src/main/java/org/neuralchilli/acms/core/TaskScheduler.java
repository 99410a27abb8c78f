package org.neuralchilli.acms.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.neuralchilli.acms.domain.DagStatistics;
import org.neuralchilli.acms.domain.Task;
import org.neuralchilli.acms.domain.TaskGraph;
import org.neuralchilli.acms.domain.Wave;
import org.neuralchilli.acms.domain.WavePlan;
import org.neuralchilli.acms.service.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes deterministic execution waves for a task graph using JGraphT.
 *
 * <p>Kahn's algorithm, where every ready set becomes one wave. Ties inside a wave are
 * broken by descending priority, then ascending task id, so the plan never depends on
 * hashing or iteration order. Stateless: one instance serves any number of graphs.
 */
@ApplicationScoped
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /**
     * Wave ordering: higher priority first, then task id ascending.
     */
    public static final Comparator<Task> TIE_BREAK =
            Comparator.comparingInt(Task::priority).reversed().thenComparing(Task::id);

    /**
     * Build the dependency graph. Edge direction is dependency -> dependent.
     */
    public Graph<String, DefaultEdge> buildGraph(TaskGraph taskGraph) {
        Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);

        for (Task task : taskGraph.tasks()) {
            graph.addVertex(task.id());
        }

        for (Task task : taskGraph.tasks()) {
            for (String dependency : task.dependencies()) {
                graph.addEdge(dependency, task.id());
                log.trace("Added edge: {} -> {}", dependency, task.id());
            }
        }

        return graph;
    }

    /**
     * Compute the wave plan for a graph.
     *
     * @throws CycleDetectedException if some tasks can never become ready
     */
    public WavePlan plan(TaskGraph taskGraph) {
        if (taskGraph.isEmpty()) {
            log.debug("Task graph '{}' is empty, nothing to schedule", taskGraph.name());
            return WavePlan.empty();
        }

        Graph<String, DefaultEdge> graph = buildGraph(taskGraph);
        Comparator<String> order = tieBreak(taskGraph);

        Map<String, Integer> inDegree = new HashMap<>();
        List<String> ready = new ArrayList<>();
        for (String taskId : graph.vertexSet()) {
            int degree = graph.inDegreeOf(taskId);
            inDegree.put(taskId, degree);
            if (degree == 0) {
                ready.add(taskId);
            }
        }
        ready.sort(order);

        List<Wave> waves = new ArrayList<>();
        int visited = 0;

        while (!ready.isEmpty()) {
            Wave wave = new Wave(waves.size() + 1, ready);
            waves.add(wave);
            visited += wave.size();

            List<String> nextReady = new ArrayList<>();
            for (String taskId : wave.taskIds()) {
                for (DefaultEdge edge : graph.outgoingEdgesOf(taskId)) {
                    String dependent = graph.getEdgeTarget(edge);
                    int remaining = inDegree.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        nextReady.add(dependent);
                    }
                }
            }

            nextReady.sort(order);
            ready = nextReady;
        }

        if (visited != taskGraph.size()) {
            List<String> members = cycleMembers(graph, inDegree);
            throw new CycleDetectedException(
                    "Cycle detected in task graph '" + taskGraph.name() + "' involving tasks: " + members,
                    members
            );
        }

        WavePlan plan = new WavePlan(waves);
        log.debug("Scheduled graph '{}': {}", taskGraph.name(), plan);
        return plan;
    }

    /**
     * Linear execution order: waves concatenated in order.
     */
    public List<String> topologicalOrder(TaskGraph taskGraph) {
        return plan(taskGraph).flatten();
    }

    /**
     * Immediate dependencies of a task, sorted.
     */
    public Set<String> dependenciesOf(TaskGraph taskGraph, String taskId) {
        return new TreeSet<>(taskGraph.task(taskId).dependencies());
    }

    /**
     * Immediate dependents of a task, sorted.
     */
    public Set<String> dependentsOf(TaskGraph taskGraph, String taskId) {
        taskGraph.task(taskId);
        Set<String> dependents = new TreeSet<>();
        for (Task task : taskGraph.tasks()) {
            if (task.dependsOn(taskId)) {
                dependents.add(task.id());
            }
        }
        return dependents;
    }

    /**
     * Get statistics about the graph structure.
     *
     * @throws CycleDetectedException if the graph is not acyclic
     */
    public DagStatistics statistics(TaskGraph taskGraph) {
        return DagStatistics.of(taskGraph, plan(taskGraph));
    }

    private static Comparator<String> tieBreak(TaskGraph taskGraph) {
        return Comparator.comparing(taskGraph::task, TIE_BREAK);
    }

    private static List<String> cycleMembers(Graph<String, DefaultEdge> graph, Map<String, Integer> inDegree) {
        Set<String> members = new TreeSet<>(new CycleDetector<>(graph).findCycles());
        if (members.isEmpty()) {
            // Fall back to every task that never became ready
            inDegree.forEach((taskId, degree) -> {
                if (degree > 0) {
                    members.add(taskId);
                }
            });
        }
        return List.copyOf(members);
    }
}
