package org.neuralchilli.acms.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable graph of tasks and their declared dependencies.
 * Referential integrity is validated at construction; cycles are left to the scheduler.
 */
public final class TaskGraph {

    public static final String DEFAULT_NAME = "task-graph";

    private final String name;
    private final List<Task> tasks;
    private final Map<String, Task> tasksById;

    public TaskGraph(String name, List<Task> tasks) {
        if (tasks == null) {
            throw new GraphValidationException("Task graph must define a 'tasks' collection");
        }

        List<String> errors = new ArrayList<>();
        Map<String, Task> byId = new LinkedHashMap<>();

        for (Task task : tasks) {
            if (task == null) {
                errors.add("Task graph contains a null task entry");
                continue;
            }
            if (byId.putIfAbsent(task.id(), task) != null) {
                errors.add("Duplicate task id '" + task.id() + "'");
            }
        }

        for (Task task : byId.values()) {
            for (String dependency : task.dependencies()) {
                if (!byId.containsKey(dependency)) {
                    errors.add("Task '" + task.id() + "' depends on '" + dependency +
                            "' which is not defined in this graph");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new GraphValidationException(
                    "Task graph validation failed for '" + effectiveName(name) + "':\n" +
                            String.join("\n", errors)
            );
        }

        this.name = effectiveName(name);
        this.tasks = List.copyOf(byId.values());
        this.tasksById = Collections.unmodifiableMap(byId);
    }

    public TaskGraph(List<Task> tasks) {
        this(null, tasks);
    }

    /**
     * Graph with no tasks; schedules to an empty plan.
     */
    public static TaskGraph empty() {
        return new TaskGraph(List.of());
    }

    private static String effectiveName(String name) {
        return name == null || name.isBlank() ? DEFAULT_NAME : name;
    }

    public String name() {
        return name;
    }

    public List<Task> tasks() {
        return tasks;
    }

    public Optional<Task> findTask(String taskId) {
        return Optional.ofNullable(tasksById.get(taskId));
    }

    /**
     * Look up a task that must exist.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public Task task(String taskId) {
        Task task = tasksById.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task '" + taskId + "' in graph '" + name + "'");
        }
        return task;
    }

    public Set<String> taskIds() {
        return tasksById.keySet();
    }

    public boolean contains(String taskId) {
        return tasksById.containsKey(taskId);
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        TaskGraph that = (TaskGraph) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.tasks, that.tasks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tasks);
    }

    @Override
    public String toString() {
        return "TaskGraph[name=" + name + ", tasks=" + taskIds() + ']';
    }

    /**
     * Builder for creating graphs fluently
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private final List<Task> tasks = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder task(Task task) {
            this.tasks.add(task);
            return this;
        }

        public Builder task(Task.Builder task) {
            return task(task.build());
        }

        public Builder tasks(List<Task> tasks) {
            this.tasks.addAll(tasks);
            return this;
        }

        public TaskGraph build() {
            return new TaskGraph(name, tasks);
        }
    }
}
