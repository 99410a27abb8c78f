package org.neuralchilli.acms.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.acms.core.Orchestrator;
import org.neuralchilli.acms.core.OrchestratorSettings;
import org.neuralchilli.acms.core.TaskScheduler;
import org.neuralchilli.acms.observability.JsonlLedger;
import org.neuralchilli.acms.observability.MeterTracer;
import org.neuralchilli.acms.observability.NoOpTracer;
import org.neuralchilli.acms.observability.OrchestrationMonitor;
import org.neuralchilli.acms.observability.Tracer;
import org.neuralchilli.acms.plugin.WorkflowPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Produces the orchestrator and its collaborators from {@link AcmsConfig}.
 */
@ApplicationScoped
public class OrchestratorProducer {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorProducer.class);

    @Inject
    AcmsConfig config;

    @Produces
    @Singleton
    public JsonlLedger ledger() {
        Path path = Path.of(config.ledger().path());
        log.info("Writing ledger to {} (sorted keys: {})", path.toAbsolutePath(), config.ledger().sortKeys());
        return new JsonlLedger(path, config.ledger().sortKeys());
    }

    @Produces
    @Singleton
    @DefaultBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Produces
    @Singleton
    public Tracer tracer(MeterRegistry registry) {
        if (!config.tracing().enabled()) {
            log.info("Tracing disabled");
            return NoOpTracer.INSTANCE;
        }
        return new MeterTracer(registry);
    }

    @Produces
    @Singleton
    public OrchestratorSettings orchestratorSettings() {
        return new OrchestratorSettings(
                config.orchestrator().parallelism(),
                config.orchestrator().hookFailurePolicy()
        );
    }

    @Produces
    @Singleton
    public Orchestrator orchestrator(
            TaskScheduler scheduler,
            JsonlLedger ledger,
            Tracer tracer,
            Instance<WorkflowPlugin> plugins,
            OrchestratorSettings settings,
            OrchestrationMonitor monitor
    ) {
        List<WorkflowPlugin> discovered = plugins.stream().toList();
        log.info("Orchestrator configured: parallelism={}, hook failure policy={}, plugins={}",
                settings.parallelism(),
                settings.hookFailurePolicy(),
                discovered.stream().map(WorkflowPlugin::name).toList());
        return new Orchestrator(scheduler, ledger, tracer, discovered, settings, monitor);
    }
}
