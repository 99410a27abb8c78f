package org.neuralchilli.acms.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import org.neuralchilli.acms.plugin.HookFailurePolicy;

import java.util.Optional;

@ConfigMapping(prefix = "acms")
public interface AcmsConfig {

    LedgerConfig ledger();

    OrchestratorConfig orchestrator();

    TracingConfig tracing();

    ExecutorConfig executor();

    GraphsConfig graphs();

    interface LedgerConfig {

        @WithDefault("logs/ledger.jsonl")
        String path();

        @WithName("sort-keys")
        @WithDefault("true")
        boolean sortKeys();
    }

    interface OrchestratorConfig {

        /**
         * Tasks of one wave allowed to run at once; 1 keeps the sequential order.
         */
        @WithDefault("1")
        int parallelism();

        @WithName("hook-failure-policy")
        @WithDefault("ABORT")
        HookFailurePolicy hookFailurePolicy();
    }

    interface TracingConfig {

        @WithDefault("true")
        boolean enabled();
    }

    interface ExecutorConfig {

        /**
         * Log commands instead of running them.
         */
        @WithName("trial-run")
        @WithDefault("false")
        boolean trialRun();

        @WithName("default-timeout-seconds")
        @WithDefault("3600")
        int defaultTimeoutSeconds();
    }

    interface GraphsConfig {

        /**
         * Directory of graph documents loaded at startup.
         */
        Optional<String> directory();
    }
}
