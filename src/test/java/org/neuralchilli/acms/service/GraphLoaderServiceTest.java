package org.neuralchilli.acms.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.acms.config.TaskGraphParser;
import org.neuralchilli.acms.core.TaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GraphLoaderServiceTest {

    private static final Path MIXED_GRAPHS = Path.of("src/test/resources/mixed-graphs");

    private GraphLoaderService loader;

    @BeforeEach
    void setUp() {
        loader = new GraphLoaderService();
        loader.parser = new TaskGraphParser();
        loader.scheduler = new TaskScheduler();
    }

    @Test
    void shouldLoadValidGraphsAndReportFailures() {
        List<LoadResult> results = loader.loadAllGraphs(MIXED_GRAPHS);

        assertThat(results).extracting(LoadResult::name)
                .containsExactly("cycle.yaml", "no-tasks.yaml", "single");
        assertThat(results).extracting(LoadResult::isSuccess)
                .containsExactly(false, false, true);

        assertThat(results.get(0).error()).hasValueSatisfying(e -> assertThat(e).contains("Cycle detected"));
        assertThat(results.get(1).error()).hasValueSatisfying(e -> assertThat(e).contains("at least one task"));
        assertThat(results.get(2)).isEqualTo(LoadResult.success("single", 1));

        assertThat(loader.getGraphs()).containsOnlyKeys("single");
        assertThat(loader.getGraph("single")).hasValueSatisfying(g -> assertThat(g.taskIds()).containsExactly("only"));
        assertThat(loader.getGraph("cycle")).isEmpty();
    }

    @Test
    void shouldReturnNothingForMissingDirectory(@TempDir Path dir) {
        assertThat(loader.loadAllGraphs(dir.resolve("absent"))).isEmpty();
        assertThat(loader.getGraphs()).isEmpty();
    }

    @Test
    void shouldReplaceGraphOnReload(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("etl.yaml");
        Files.writeString(file, "tasks:\n  - id: extract\n");
        assertThat(loader.loadGraph(file).isSuccess()).isTrue();

        Files.writeString(file, "tasks:\n  - id: extract\n  - id: load\n    dependencies: [extract]\n");
        LoadResult reloaded = loader.reloadGraph(file);

        assertThat(reloaded).isEqualTo(LoadResult.success("etl", 2));
        assertThat(loader.getGraph("etl")).hasValueSatisfying(g -> assertThat(g.size()).isEqualTo(2));
    }

    @Test
    void shouldKeepPreviousGraphWhenReloadFails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("etl.yaml");
        Files.writeString(file, "tasks:\n  - id: extract\n");
        loader.loadGraph(file);

        Files.writeString(file, "tasks:\n  - id: extract\n    dependencies: [extract]\n");
        LoadResult reloaded = loader.reloadGraph(file);

        assertThat(reloaded.isSuccess()).isFalse();
        assertThat(loader.getGraph("etl")).hasValueSatisfying(g -> assertThat(g.size()).isEqualTo(1));
    }

    @Test
    void shouldReportUnreadableFile(@TempDir Path dir) {
        LoadResult result = loader.loadGraph(dir.resolve("ghost.yaml"));

        assertThat(result).isInstanceOf(LoadResult.Failure.class);
        assertThat(result.name()).isEqualTo("ghost.yaml");
    }

    @Test
    void shouldClearLoadedGraphs() {
        loader.loadAllGraphs(MIXED_GRAPHS);

        loader.clear();

        assertThat(loader.getGraphs()).isEmpty();
    }
}
