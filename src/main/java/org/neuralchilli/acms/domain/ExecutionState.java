package org.neuralchilli.acms.domain;

/**
 * Lifecycle state of a task execution.
 */
public enum ExecutionState {
    /**
     * Waiting to run (initially, or after a failed attempt was reset for retry)
     */
    PENDING,

    /**
     * Executor is currently working on the task
     */
    RUNNING,

    /**
     * Task completed successfully
     */
    COMPLETED,

    /**
     * Last attempt failed (may retry while attempts remain)
     */
    FAILED,

    /**
     * Task was skipped without running
     */
    SKIPPED,

    /**
     * Task was cancelled between attempts
     */
    CANCELLED;

    /**
     * Terminal states have no outgoing transitions.
     * FAILED is not terminal: it may move back to PENDING or on to CANCELLED.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == CANCELLED;
    }

    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
