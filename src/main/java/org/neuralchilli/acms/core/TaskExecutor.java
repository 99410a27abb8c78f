package org.neuralchilli.acms.core;

/**
 * Executes a single attempt of a task.
 * Returning normally completes the attempt; throwing fails it and lets the
 * orchestrator apply the retry budget.
 */
@FunctionalInterface
public interface TaskExecutor {

    /**
     * @param taskId    id of the task being attempted
     * @param execution live execution record; read-only for the executor
     * @return task output, may be null
     * @throws Exception any failure of this attempt
     */
    Object execute(String taskId, TaskExecution execution) throws Exception;
}
