package org.neuralchilli.acms.core;

import org.neuralchilli.acms.plugin.HookFailurePolicy;

/**
 * Run-time knobs of the orchestrator.
 *
 * @param parallelism       maximum tasks of one wave running at once; 1 runs waves sequentially
 * @param hookFailurePolicy what a throwing lifecycle hook does to the run
 */
public record OrchestratorSettings(int parallelism, HookFailurePolicy hookFailurePolicy) {

    public OrchestratorSettings {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        }
        if (hookFailurePolicy == null) {
            hookFailurePolicy = HookFailurePolicy.ABORT;
        }
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(1, HookFailurePolicy.ABORT);
    }

    public boolean isSequential() {
        return parallelism == 1;
    }
}
