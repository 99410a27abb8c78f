package org.neuralchilli.acms;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.neuralchilli.acms.config.AcmsConfig;
import org.neuralchilli.acms.config.TaskGraphParser;
import org.neuralchilli.acms.core.TaskFailedException;
import org.neuralchilli.acms.domain.GraphValidationException;
import org.neuralchilli.acms.domain.TaskGraph;
import org.neuralchilli.acms.domain.TaskResult;
import org.neuralchilli.acms.observability.OrchestrationMonitor;
import org.neuralchilli.acms.plugin.HookFailedException;
import org.neuralchilli.acms.service.CycleDetectedException;
import org.neuralchilli.acms.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line runner:
 * <pre>
 * acms &lt;graph.yaml&gt; [--trace-id ID] [--print-result]
 * </pre>
 * Exit codes: 0 success, 1 the run failed, 2 bad usage or invalid graph.
 */
@QuarkusMain
public class AcmsCommand implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(AcmsCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: acms <graph-file> [--trace-id ID] [--print-result]";

    @Inject
    WorkflowService workflowService;

    @Inject
    TaskGraphParser parser;

    @Inject
    OrchestrationMonitor monitor;

    @Inject
    AcmsConfig config;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public int run(String... args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        if (!Files.isRegularFile(arguments.graphFile())) {
            System.err.println("Graph file not found: " + arguments.graphFile());
            return EXIT_USAGE;
        }

        log.info("Running {} (trial run: {}, parallelism: {})",
                arguments.graphFile(), config.executor().trialRun(), config.orchestrator().parallelism());

        Map<String, TaskResult> results;
        int exitCode = EXIT_OK;
        try {
            TaskGraph graph = parser.parse(arguments.graphFile());
            results = workflowService.run(graph, arguments.traceId());
        } catch (GraphValidationException | CycleDetectedException | UncheckedIOException e) {
            System.err.println("Invalid graph: " + e.getMessage());
            return EXIT_USAGE;
        } catch (TaskFailedException e) {
            System.err.println(e.getMessage());
            results = e.partialResults();
            exitCode = EXIT_RUN_FAILED;
        } catch (HookFailedException e) {
            System.err.println(e.getMessage());
            return EXIT_RUN_FAILED;
        } finally {
            monitor.logReport();
        }

        if (arguments.printResult()) {
            System.out.println(render(results));
        }
        return exitCode;
    }

    String render(Map<String, TaskResult> results) {
        Map<String, Object> view = new LinkedHashMap<>();
        results.forEach((taskId, result) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("state", result.state().name());
            entry.put("attempts", result.attempts());
            entry.put("trace_id", result.traceId());
            result.outputValue().ifPresent(output -> entry.put("output", output));
            result.errorMessage().ifPresent(error -> entry.put("error", error));
            view.put(taskId, entry);
        });
        try {
            return objectMapper.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            log.warn("Result is not serialisable as JSON: {}", e.getMessage());
            return view.toString();
        }
    }

    record Arguments(Path graphFile, String traceId, boolean printResult) {

        static Arguments parse(String... args) {
            Path graphFile = null;
            String traceId = null;
            boolean printResult = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--trace-id" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--trace-id needs a value");
                        }
                        traceId = args[++i];
                    }
                    case "--print-result" -> printResult = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (graphFile != null) {
                            throw new IllegalArgumentException("Only one graph file can be given");
                        }
                        graphFile = Path.of(arg);
                    }
                }
            }

            if (graphFile == null) {
                throw new IllegalArgumentException("Missing graph file");
            }
            return new Arguments(graphFile, traceId, printResult);
        }
    }
}
