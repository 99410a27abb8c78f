package org.neuralchilli.acms.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.acms.config.AcmsConfig;
import org.neuralchilli.acms.config.TaskGraphParser;
import org.neuralchilli.acms.core.TaskScheduler;
import org.neuralchilli.acms.domain.TaskGraph;
import org.neuralchilli.acms.domain.WavePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Loads graph documents from a directory, validates them and keeps them by name.
 * A graph is only registered once it parses and plans without a cycle.
 */
@ApplicationScoped
public class GraphLoaderService {

    private static final Logger log = LoggerFactory.getLogger(GraphLoaderService.class);

    @Inject
    TaskGraphParser parser;

    @Inject
    TaskScheduler scheduler;

    @Inject
    AcmsConfig config;

    private final Map<String, TaskGraph> graphs = new ConcurrentHashMap<>();

    /**
     * Load the configured graphs directory on startup, if one is set
     */
    void onStart(@Observes StartupEvent event) {
        Optional<String> directory = config.graphs().directory();
        if (directory.isEmpty()) {
            log.debug("No graphs directory configured");
            return;
        }
        log.info("Loading graphs from: {}", directory.get());
        logResults(loadAllGraphs(Path.of(directory.get())));
    }

    /**
     * Load every .yaml, .yml and .json file under a directory, in path order
     */
    public List<LoadResult> loadAllGraphs(Path graphsDir) {
        List<LoadResult> results = new ArrayList<>();

        if (!Files.exists(graphsDir)) {
            log.warn("Graphs directory does not exist: {}", graphsDir);
            return results;
        }

        try (Stream<Path> paths = Files.walk(graphsDir)) {
            paths.filter(Files::isRegularFile)
                    .filter(GraphLoaderService::isGraphDocument)
                    .sorted()
                    .forEach(path -> results.add(loadGraph(path)));
        } catch (IOException e) {
            log.error("Error scanning graphs directory: {}", graphsDir, e);
        }

        return results;
    }

    /**
     * Load a single graph from file
     */
    public LoadResult loadGraph(Path path) {
        try {
            log.debug("Loading graph from: {}", path);

            TaskGraph graph = parser.parse(path);
            WavePlan plan = scheduler.plan(graph);

            TaskGraph previous = graphs.put(graph.name(), graph);
            if (previous != null) {
                log.warn("Graph '{}' from {} replaces an earlier definition", graph.name(), path);
            }

            log.info("✓ Loaded graph: {} ({} tasks, {} waves)", graph.name(), graph.size(), plan.totalWaves());
            return LoadResult.success(graph.name(), graph.size());

        } catch (RuntimeException e) {
            log.error("✗ Failed to load graph from: {}: {}", path, e.getMessage());
            return LoadResult.failure(path.getFileName().toString(), e);
        }
    }

    /**
     * Reload a graph file
     */
    public LoadResult reloadGraph(Path path) {
        log.info("Reloading graph: {}", path);
        return loadGraph(path);
    }

    public Optional<TaskGraph> getGraph(String name) {
        return Optional.ofNullable(graphs.get(name));
    }

    public Map<String, TaskGraph> getGraphs() {
        return Collections.unmodifiableMap(graphs);
    }

    public void clear() {
        graphs.clear();
    }

    private static boolean isGraphDocument(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} graphs: {} successful, {} failed", results.size(), successful, failed);

            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  ✗ {}: {}", r.name(), r.error().orElse("unknown error")));
        } else {
            log.info("Loaded {} graphs: all successful", results.size());
        }
    }
}
