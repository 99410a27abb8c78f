package org.neuralchilli.acms.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable description of a unit of work inside a task graph.
 * Metadata is carried through to the executor unchanged.
 */
public record Task(
        String id,
        Set<String> dependencies,
        int priority,
        int maxAttempts,
        Map<String, Object> metadata
) {
    public static final int DEFAULT_PRIORITY = 0;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                    "Task '" + id + "' max_attempts must be >= 1, got: " + maxAttempts
            );
        }

        // Defaults; declaration order is kept so error messages stay stable
        dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Check if this task has no declared dependencies
     */
    public boolean isRoot() {
        return dependencies.isEmpty();
    }

    public boolean dependsOn(String taskId) {
        return dependencies.contains(taskId);
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private Set<String> dependencies = new LinkedHashSet<>();
        private int priority = DEFAULT_PRIORITY;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder(String id) {
            this.id = id;
        }

        public Builder dependsOn(String... taskIds) {
            Collections.addAll(this.dependencies, taskIds);
            return this;
        }

        public Builder dependencies(Collection<String> dependencies) {
            this.dependencies = new LinkedHashSet<>(dependencies);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Task build() {
            return new Task(id, dependencies, priority, maxAttempts, metadata);
        }
    }
}
