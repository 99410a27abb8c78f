package org.neuralchilli.acms.plugin;

/**
 * What the orchestrator does when a lifecycle hook throws.
 */
public enum HookFailurePolicy {
    /**
     * Log the failure and carry on with the run
     */
    LOG_AND_CONTINUE,

    /**
     * Abort the run with a {@link HookFailedException} once the current transition is complete.
     * This is the default.
     */
    ABORT
}
