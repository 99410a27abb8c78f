package org.neuralchilli.acms.worker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.acms.core.TaskExecution;
import org.neuralchilli.acms.core.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs a task as an OS process described by its metadata:
 * <ul>
 *   <li>{@code command}: executable (required)</li>
 *   <li>{@code args}: list of arguments</li>
 *   <li>{@code env}: extra environment variables</li>
 *   <li>{@code timeout}: seconds before the process is killed</li>
 * </ul>
 * Supports trial-run mode for checking graphs without executing anything.
 */
@ApplicationScoped
public class CommandTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandTaskExecutor.class);

    static final String COMMAND = "command";
    static final String ARGS = "args";
    static final String ENV = "env";
    static final String TIMEOUT = "timeout";

    @ConfigProperty(name = "acms.executor.trial-run", defaultValue = "false")
    boolean trialRun;

    @ConfigProperty(name = "acms.executor.default-timeout-seconds", defaultValue = "3600")
    int defaultTimeoutSeconds;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public CommandTaskExecutor() {
    }

    public CommandTaskExecutor(boolean trialRun, int defaultTimeoutSeconds) {
        this.trialRun = trialRun;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    @Override
    public Object execute(String taskId, TaskExecution execution) throws InterruptedException {
        Map<String, Object> metadata = execution.metadata();
        Object command = metadata.get(COMMAND);
        if (command == null || command.toString().isBlank()) {
            throw new TaskCommandException("Task " + taskId + " has no '" + COMMAND + "' to run");
        }

        List<String> fullCommand = new ArrayList<>();
        fullCommand.add(command.toString());
        fullCommand.addAll(stringList(metadata.get(ARGS)));
        Map<String, String> env = stringMap(metadata.get(ENV));
        int timeoutSeconds = timeoutSeconds(metadata.get(TIMEOUT));

        if (trialRun) {
            return executeTrialRun(taskId, execution, fullCommand, env, timeoutSeconds);
        }
        return executeCommand(taskId, fullCommand, env, timeoutSeconds);
    }

    public boolean isTrialRun() {
        return trialRun;
    }

    private Map<String, Object> executeTrialRun(
            String taskId,
            TaskExecution execution,
            List<String> command,
            Map<String, String> env,
            int timeoutSeconds
    ) {
        String commandStr = String.join(" ", command);

        log.info("TRIAL RUN - would execute task {} (attempt {}/{}, trace {})",
                taskId, execution.attempt(), execution.maxAttempts(), execution.traceId());
        log.info("  Command: {}", commandStr);
        log.info("  Timeout: {}s", timeoutSeconds);
        env.forEach((k, v) -> log.info("  {}={}", k, v));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("trial_run", true);
        result.put("command", commandStr);
        result.put("timeout", timeoutSeconds);
        result.put("attempt", execution.attempt());
        return result;
    }

    private Map<String, Object> executeCommand(
            String taskId,
            List<String> command,
            Map<String, String> env,
            int timeoutSeconds
    ) throws InterruptedException {
        log.debug("Executing task {}: {}", taskId, String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().putAll(env);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TaskCommandException("Failed to start process for task " + taskId + ": " + e.getMessage(), e);
        }

        StringBuilder output = new StringBuilder();
        Thread reader = new Thread(() -> drain(process, taskId, output), "acms-output-" + taskId);
        reader.setDaemon(true);
        reader.start();

        boolean completed;
        try {
            completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            log.warn("Task {} interrupted, killing its process", taskId);
            process.destroyForcibly();
            throw e;
        }
        if (!completed) {
            process.destroyForcibly();
            reader.join(TimeUnit.SECONDS.toMillis(1));
            throw new TaskCommandException("Task " + taskId + " timed out after " + timeoutSeconds + " seconds");
        }
        reader.join();

        int exitCode = process.exitValue();
        String text;
        synchronized (output) {
            text = output.toString();
        }
        if (exitCode != 0) {
            throw new TaskCommandException("Task " + taskId + " exited with code " + exitCode + "\n" + text.trim(), exitCode);
        }
        return tryParseJsonOutput(text);
    }

    private void drain(Process process, String taskId, StringBuilder output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (output) {
                    output.append(line).append("\n");
                }
                log.info("[{}] {}", taskId, line);
            }
        } catch (IOException e) {
            log.debug("Output stream of task {} closed: {}", taskId, e.getMessage());
        }
    }

    /**
     * Parse the last output line as a JSON object when it is one,
     * otherwise return the whole output under {@code output}.
     */
    Map<String, Object> tryParseJsonOutput(String output) {
        String trimmed = output.trim();
        String[] lines = trimmed.split("\n");
        String lastLine = lines[lines.length - 1].trim();

        if (lastLine.startsWith("{") && lastLine.endsWith("}")) {
            try {
                return objectMapper.readValue(lastLine, new TypeReference<Map<String, Object>>() {});
            } catch (IOException e) {
                log.trace("Last line is not valid JSON: {}", e.getMessage());
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("output", trimmed);
        return result;
    }

    private int timeoutSeconds(Object value) {
        if (value == null) {
            return defaultTimeoutSeconds;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new TaskCommandException("Invalid timeout '" + value + "'", e);
        }
    }

    private static List<String> stringList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value != null) {
            return List.of(value.toString());
        }
        return List.of();
    }

    private static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(k.toString(), v != null ? v.toString() : ""));
        }
        return result;
    }
}
