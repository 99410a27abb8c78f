package org.neuralchilli.acms.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskGraphTest {

    @Test
    void shouldBuildGraphPreservingTaskOrder() {
        TaskGraph graph = TaskGraph.builder()
                .name("etl")
                .task(Task.builder("extract"))
                .task(Task.builder("transform").dependsOn("extract"))
                .task(Task.builder("load").dependsOn("transform"))
                .build();

        assertThat(graph.name()).isEqualTo("etl");
        assertThat(graph.size()).isEqualTo(3);
        assertThat(graph.taskIds()).containsExactly("extract", "transform", "load");
        assertThat(graph.contains("load")).isTrue();
        assertThat(graph.findTask("missing")).isEmpty();
        assertThat(graph.task("transform").dependencies()).containsExactly("extract");
    }

    @Test
    void shouldUseDefaultNameWhenNoneGiven() {
        TaskGraph graph = new TaskGraph(List.of(Task.builder("a").build()));

        assertThat(graph.name()).isEqualTo(TaskGraph.DEFAULT_NAME);
    }

    @Test
    void shouldAllowEmptyGraph() {
        TaskGraph graph = TaskGraph.empty();

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.size()).isZero();
    }

    @Test
    void shouldRejectNullTaskList() {
        assertThatThrownBy(() -> new TaskGraph("g", null))
                .isInstanceOf(GraphValidationException.class)
                .hasMessageContaining("tasks");
    }

    @Test
    void shouldRejectUnknownDependency() {
        assertThatThrownBy(() -> TaskGraph.builder()
                .name("broken")
                .task(Task.builder("a").dependsOn("z"))
                .build())
                .isInstanceOf(GraphValidationException.class)
                .hasMessageContaining("Task graph validation failed for 'broken'")
                .hasMessageContaining("Task 'a' depends on 'z' which is not defined in this graph");
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> TaskGraph.builder()
                .task(Task.builder("x"))
                .task(Task.builder("x").priority(2))
                .build())
                .isInstanceOf(GraphValidationException.class)
                .hasMessageContaining("Duplicate task id 'x'");
    }

    @Test
    void shouldReportAllErrorsAtOnce() {
        List<Task> tasks = new ArrayList<>(Arrays.asList(
                Task.builder("a").dependsOn("missing-1").build(),
                Task.builder("a").build(),
                null,
                Task.builder("b").dependsOn("missing-2").build()
        ));

        assertThatThrownBy(() -> new TaskGraph("many", tasks))
                .isInstanceOf(GraphValidationException.class)
                .hasMessageContaining("Duplicate task id 'a'")
                .hasMessageContaining("null task entry")
                .hasMessageContaining("'missing-1'")
                .hasMessageContaining("'missing-2'");
    }

    @Test
    void shouldAcceptSelfDependencyAtConstruction() {
        // cycles, including 1-cycles, are the scheduler's concern
        TaskGraph graph = TaskGraph.builder()
                .task(Task.builder("loop").dependsOn("loop"))
                .build();

        assertThat(graph.task("loop").dependsOn("loop")).isTrue();
    }

    @Test
    void shouldFailLookupOfUnknownTask() {
        TaskGraph graph = new TaskGraph(List.of(Task.builder("a").build()));

        assertThatThrownBy(() -> graph.task("b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown task 'b'");
    }

    @Test
    void shouldCompareByNameAndTasks() {
        TaskGraph first = TaskGraph.builder().name("g").task(Task.builder("a")).build();
        TaskGraph second = TaskGraph.builder().name("g").task(Task.builder("a")).build();
        TaskGraph renamed = TaskGraph.builder().name("h").task(Task.builder("a")).build();

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(renamed);
    }
}
