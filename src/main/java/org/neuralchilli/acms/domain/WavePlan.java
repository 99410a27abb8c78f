package org.neuralchilli.acms.domain;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Ordered sequence of waves computed by the scheduler.
 * Every dependency of a task sits in a strictly earlier wave than the task itself.
 */
public record WavePlan(List<Wave> waves) {

    public WavePlan {
        waves = waves != null ? List.copyOf(waves) : List.of();
    }

    public static WavePlan empty() {
        return new WavePlan(List.of());
    }

    public int totalWaves() {
        return waves.size();
    }

    public int totalTasks() {
        return waves.stream().mapToInt(Wave::size).sum();
    }

    public int maxParallelism() {
        return waves.stream().mapToInt(Wave::size).max().orElse(0);
    }

    public boolean isEmpty() {
        return waves.isEmpty();
    }

    /**
     * Waves as plain id lists, the shape used when comparing plans.
     */
    public List<List<String>> taskIdsByWave() {
        return waves.stream().map(Wave::taskIds).toList();
    }

    /**
     * Flatten the plan into a single execution order.
     */
    public List<String> flatten() {
        List<String> order = new ArrayList<>(totalTasks());
        waves.forEach(wave -> order.addAll(wave.taskIds()));
        return order;
    }

    /**
     * Get the 1-based index of the wave containing a task
     */
    public OptionalInt waveOf(String taskId) {
        return waves.stream()
                .filter(wave -> wave.contains(taskId))
                .mapToInt(Wave::index)
                .findFirst();
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "WavePlan[tasks=%d, waves=%d, max_parallel=%d, order=%s]",
                totalTasks(), totalWaves(), maxParallelism(), taskIdsByWave()
        );
    }
}
