package org.neuralchilli.acms.plugin;

import org.neuralchilli.acms.core.TaskExecution;
import org.neuralchilli.acms.domain.Task;
import org.neuralchilli.acms.domain.TaskGraph;
import org.neuralchilli.acms.domain.TaskResult;
import org.neuralchilli.acms.observability.OrchestrationMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Ordered set of lifecycle plugins plus the policy applied when one of them throws.
 * Plugins are invoked sorted by name so hook order is reproducible.
 */
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    static final String BEFORE_WORKFLOW = "before_workflow";
    static final String AFTER_TASK = "after_task";
    static final String AFTER_WORKFLOW = "after_workflow";

    private final List<WorkflowPlugin> plugins;
    private final HookFailurePolicy failurePolicy;
    private final OrchestrationMonitor monitor;

    public PluginRegistry(List<? extends WorkflowPlugin> plugins, HookFailurePolicy failurePolicy, OrchestrationMonitor monitor) {
        List<WorkflowPlugin> sorted = new ArrayList<>(plugins != null ? plugins : List.of());
        sorted.sort(Comparator.comparing(WorkflowPlugin::name));
        this.plugins = List.copyOf(sorted);
        this.failurePolicy = failurePolicy != null ? failurePolicy : HookFailurePolicy.ABORT;
        this.monitor = monitor;
    }

    public static PluginRegistry empty() {
        return new PluginRegistry(List.of(), HookFailurePolicy.ABORT, null);
    }

    public List<WorkflowPlugin> plugins() {
        return plugins;
    }

    public HookFailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public boolean isEmpty() {
        return plugins.isEmpty();
    }

    public void beforeWorkflow(TaskGraph graph, String traceId) {
        invoke(BEFORE_WORKFLOW, plugin -> plugin.beforeWorkflow(graph, traceId), false);
    }

    /**
     * @param aborting true while the run is already being torn down; failures are then only logged
     */
    public void afterTask(Task task, TaskExecution execution, boolean aborting) {
        invoke(AFTER_TASK, plugin -> plugin.afterTask(task, execution), aborting);
    }

    public void afterWorkflow(Map<String, TaskResult> results, String traceId, boolean aborting) {
        invoke(AFTER_WORKFLOW, plugin -> plugin.afterWorkflow(results, traceId), aborting);
    }

    private void invoke(String hook, Consumer<WorkflowPlugin> call, boolean aborting) {
        for (WorkflowPlugin plugin : plugins) {
            try {
                call.accept(plugin);
            } catch (RuntimeException e) {
                if (monitor != null) {
                    monitor.recordHookFailure();
                }
                if (failurePolicy == HookFailurePolicy.ABORT && !aborting) {
                    log.error("Plugin '{}' failed in {}, aborting run", plugin.name(), hook, e);
                    throw new HookFailedException(plugin.name(), hook, e);
                }
                log.warn("Plugin '{}' failed in {}, continuing: {}", plugin.name(), hook, e.getMessage(), e);
            }
        }
    }
}
