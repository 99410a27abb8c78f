package org.neuralchilli.acms.domain;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.Set;

/**
 * Shape of a task graph as seen by its wave plan.
 *
 * @param totalTasks      number of tasks
 * @param dependencyCount number of dependency edges
 * @param rootTasks       tasks without dependencies
 * @param leafTasks       tasks nothing depends on
 * @param executionLevels number of waves
 * @param maxParallelism  size of the widest wave
 */
public record DagStatistics(
        int totalTasks,
        int dependencyCount,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism
) {
    public DagStatistics {
        if (totalTasks < 0 || dependencyCount < 0 || rootTasks < 0 || leafTasks < 0
                || executionLevels < 0 || maxParallelism < 0) {
            throw new IllegalArgumentException("Graph statistics cannot be negative");
        }
        if (rootTasks > totalTasks || leafTasks > totalTasks) {
            throw new IllegalArgumentException(
                    "Roots (" + rootTasks + ") and leaves (" + leafTasks + ") cannot exceed " + totalTasks + " tasks");
        }
    }

    /**
     * Derive statistics from a graph and the plan scheduled for it.
     */
    public static DagStatistics of(TaskGraph graph, WavePlan plan) {
        Set<String> dependedOn = new HashSet<>();
        int edges = 0;
        int roots = 0;
        for (Task task : graph.tasks()) {
            edges += task.dependencies().size();
            dependedOn.addAll(task.dependencies());
            if (task.isRoot()) {
                roots++;
            }
        }
        return new DagStatistics(
                graph.size(),
                edges,
                roots,
                graph.size() - dependedOn.size(),
                plan.totalWaves(),
                plan.maxParallelism()
        );
    }

    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    /**
     * One task per wave.
     */
    public boolean isLinear() {
        return maxParallelism == 1;
    }

    @Nonnull
    @Override
    public String toString() {
        return "DagStatistics[tasks=" + totalTasks
                + ", edges=" + dependencyCount
                + ", levels=" + executionLevels
                + ", max_parallel=" + maxParallelism
                + ", roots=" + rootTasks
                + ", leaves=" + leafTasks + "]";
    }
}
