package org.neuralchilli.acms.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.neuralchilli.acms.core.TaskExecution;
import org.neuralchilli.acms.domain.Task;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.map;

class CommandTaskExecutorTest {

    private static TaskExecution execution(Task task) {
        return TaskExecution.create(task);
    }

    @Test
    void shouldDescribeCommandInTrialRun() throws Exception {
        CommandTaskExecutor executor = new CommandTaskExecutor(true, 3600);
        Task task = Task.builder("load")
                .metadata("command", "python")
                .metadata("args", List.of("load.py", "--full"))
                .metadata("env", Map.of("REGION", "eu"))
                .build();

        Object output = executor.execute("load", execution(task));

        assertThat(executor.isTrialRun()).isTrue();
        assertThat(output).asInstanceOf(map(String.class, Object.class))
                .containsEntry("trial_run", true)
                .containsEntry("command", "python load.py --full")
                .containsEntry("timeout", 3600);
    }

    @Test
    void shouldRequireCommand() {
        CommandTaskExecutor executor = new CommandTaskExecutor(true, 3600);
        Task task = Task.builder("nothing").build();

        assertThatThrownBy(() -> executor.execute("nothing", execution(task)))
                .isInstanceOf(TaskCommandException.class)
                .hasMessageContaining("has no 'command'");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldParseJsonFromLastOutputLine() throws Exception {
        CommandTaskExecutor executor = new CommandTaskExecutor(false, 30);
        Task task = Task.builder("emit")
                .metadata("command", "sh")
                .metadata("args", List.of("-c", "echo working; echo '{\"rows\": 42}'"))
                .build();

        Object output = executor.execute("emit", execution(task));

        assertThat(output).asInstanceOf(map(String.class, Object.class)).containsEntry("rows", 42);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldReturnPlainOutput() throws Exception {
        CommandTaskExecutor executor = new CommandTaskExecutor(false, 30);
        Task task = Task.builder("hello")
                .metadata("command", "sh")
                .metadata("args", List.of("-c", "echo \"hello $GREETING\""))
                .metadata("env", Map.of("GREETING", "world"))
                .build();

        Object output = executor.execute("hello", execution(task));

        assertThat(output).asInstanceOf(map(String.class, Object.class)).containsEntry("output", "hello world");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldFailOnNonZeroExit() {
        CommandTaskExecutor executor = new CommandTaskExecutor(false, 30);
        Task task = Task.builder("broken")
                .metadata("command", "sh")
                .metadata("args", List.of("-c", "echo oops; exit 3"))
                .build();

        assertThatThrownBy(() -> executor.execute("broken", execution(task)))
                .isInstanceOf(TaskCommandException.class)
                .hasMessageContaining("exited with code 3")
                .hasMessageContaining("oops")
                .satisfies(e -> assertThat(((TaskCommandException) e).exitCode()).isEqualTo(3));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldKillCommandAfterTimeout() {
        CommandTaskExecutor executor = new CommandTaskExecutor(false, 30);
        Task task = Task.builder("slow")
                .metadata("command", "sleep")
                .metadata("args", List.of("10"))
                .metadata("timeout", 1)
                .build();

        assertThatThrownBy(() -> executor.execute("slow", execution(task)))
                .isInstanceOf(TaskCommandException.class)
                .hasMessageContaining("timed out after 1 seconds");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldKillCommandWhenInterrupted() throws Exception {
        CommandTaskExecutor executor = new CommandTaskExecutor(false, 60);
        Task task = Task.builder("stuck")
                .metadata("command", "sleep")
                .metadata("args", List.of("47"))
                .build();

        long started = System.nanoTime();
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> executor.execute("stuck", execution(task)))
                    .isInstanceOf(InterruptedException.class);
        } finally {
            Thread.interrupted();
        }
        assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started)).isLessThan(10);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (liveSleepers() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertThat(liveSleepers()).isZero();
    }

    private static long liveSleepers() {
        return ProcessHandle.current().children()
                .filter(ProcessHandle::isAlive)
                .filter(handle -> handle.info().arguments()
                        .map(args -> List.of(args).contains("47"))
                        .orElse(false))
                .count();
    }

    @Test
    void shouldFailWhenCommandCannotStart() {
        CommandTaskExecutor executor = new CommandTaskExecutor(false, 30);
        Task task = Task.builder("missing")
                .metadata("command", "/definitely/not/a/real/binary")
                .build();

        assertThatThrownBy(() -> executor.execute("missing", execution(task)))
                .isInstanceOf(TaskCommandException.class)
                .hasMessageContaining("Failed to start process");
    }

    @Test
    void shouldFallBackToRawOutputForInvalidJson() {
        CommandTaskExecutor executor = new CommandTaskExecutor(false, 30);

        assertThat(executor.tryParseJsonOutput("line\n{not json}\n"))
                .containsEntry("output", "line\n{not json}");
    }
}
