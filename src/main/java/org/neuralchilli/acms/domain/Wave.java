package org.neuralchilli.acms.domain;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * One barrier-separated group of mutually independent tasks.
 *
 * @param index   1-based position in the plan
 * @param taskIds task ids ordered by descending priority, then ascending id
 */
public record Wave(int index, List<String> taskIds) {

    public Wave {
        if (index < 1) {
            throw new IllegalArgumentException("Wave index must be >= 1, got: " + index);
        }
        if (taskIds == null || taskIds.isEmpty()) {
            throw new IllegalArgumentException("Wave must contain at least one task");
        }
        taskIds = List.copyOf(taskIds);
    }

    public int size() {
        return taskIds.size();
    }

    /**
     * Check if tasks in this wave may run concurrently
     */
    public boolean canParallel() {
        return taskIds.size() > 1;
    }

    public boolean contains(String taskId) {
        return taskIds.contains(taskId);
    }

    @Nonnull
    @Override
    public String toString() {
        return "Wave[" + index + ": " + taskIds + "]";
    }
}
