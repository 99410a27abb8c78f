package org.neuralchilli.acms.plugin;

import org.neuralchilli.acms.core.TaskExecution;
import org.neuralchilli.acms.domain.Task;
import org.neuralchilli.acms.domain.TaskGraph;
import org.neuralchilli.acms.domain.TaskResult;

import java.util.Map;

/**
 * Lifecycle hooks invoked by the orchestrator. Every hook is optional;
 * plugins override only what they observe. Hooks observe runs, they never
 * drive state transitions.
 */
public interface WorkflowPlugin {

    /**
     * Name used for ordering and in failure reports.
     */
    default String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isBlank() ? getClass().getName() : simpleName;
    }

    /**
     * Called once before the first wave.
     */
    default void beforeWorkflow(TaskGraph graph, String traceId) {
    }

    /**
     * Called once per terminal task transition.
     */
    default void afterTask(Task task, TaskExecution execution) {
    }

    /**
     * Called once after the last wave, or when the run aborts.
     */
    default void afterWorkflow(Map<String, TaskResult> results, String traceId) {
    }
}
