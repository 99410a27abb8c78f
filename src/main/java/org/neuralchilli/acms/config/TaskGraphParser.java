package org.neuralchilli.acms.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.acms.domain.GraphValidationException;
import org.neuralchilli.acms.domain.Task;
import org.neuralchilli.acms.domain.TaskGraph;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses task graph documents (YAML or JSON) into a {@link TaskGraph}. A document whose
 * first non-blank character is <code>{</code> or <code>[</code>, or a {@code .json} file, is read as JSON.
 *
 * <pre>
 * name: nightly
 * tasks:
 *   - id: extract
 *   - id: load
 *     dependencies: [extract]
 *     priority: 5
 *     max_attempts: 2
 *     command: ./load.sh
 * </pre>
 *
 * Keys other than {@code id}, {@code dependencies}, {@code priority} and
 * {@code max_attempts} are kept as task metadata.
 */
@ApplicationScoped
public class TaskGraphParser {

    static final String NAME = "name";
    static final String TASKS = "tasks";
    static final String ID = "id";
    static final String DEPENDENCIES = "dependencies";
    static final String PRIORITY = "priority";
    static final String MAX_ATTEMPTS = "max_attempts";

    private static final Set<String> RESERVED_KEYS = Set.of(ID, DEPENDENCIES, PRIORITY, MAX_ATTEMPTS);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parse a graph definition from a string
     */
    public TaskGraph parse(String content) {
        return parseGraphFromMap(load(content));
    }

    /**
     * Parse a graph definition from an InputStream
     */
    public TaskGraph parse(InputStream inputStream) {
        return parseGraphFromMap(load(inputStream));
    }

    /**
     * Parse a graph file. The file name (without extension) names the graph unless the
     * document carries its own {@code name}.
     */
    public TaskGraph parse(Path path) {
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            boolean json = path.getFileName().toString().toLowerCase().endsWith(".json");
            Map<String, Object> data = json ? loadJson(content) : load(content);
            return parseGraphFromMap(data, baseName(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph file " + path, e);
        }
    }

    /**
     * Build a graph from an already decoded mapping.
     */
    public TaskGraph parseGraphFromMap(Map<String, Object> data) {
        return parseGraphFromMap(data, TaskGraph.DEFAULT_NAME);
    }

    private TaskGraph parseGraphFromMap(Map<String, Object> data, String defaultName) {
        if (data == null) {
            throw new GraphValidationException("Graph document is empty");
        }
        String name = getString(data, NAME, false);

        Object tasksValue = data.get(TASKS);
        if (tasksValue == null) {
            throw new GraphValidationException("Graph document must have a '" + TASKS + "' collection");
        }
        if (!(tasksValue instanceof List<?> taskList)) {
            throw new GraphValidationException("'" + TASKS + "' must be a list, got " + typeName(tasksValue));
        }
        if (taskList.isEmpty()) {
            throw new GraphValidationException("Graph must have at least one task");
        }

        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < taskList.size(); i++) {
            tasks.add(parseTask(taskList.get(i), i));
        }
        return new TaskGraph(name != null ? name : defaultName, tasks);
    }

    @SuppressWarnings("unchecked")
    private Task parseTask(Object entry, int index) {
        if (!(entry instanceof Map)) {
            throw new GraphValidationException("Task #" + index + " must be a mapping, got " + typeName(entry));
        }
        Map<String, Object> data = (Map<String, Object>) entry;

        String id;
        try {
            id = getString(data, ID, true);
        } catch (GraphValidationException e) {
            throw new GraphValidationException("Task #" + index + ": " + e.getMessage(), e);
        }

        try {
            Map<String, Object> metadata = new LinkedHashMap<>();
            data.forEach((key, value) -> {
                if (!RESERVED_KEYS.contains(String.valueOf(key))) {
                    metadata.put(String.valueOf(key), value);
                }
            });

            return Task.builder(id)
                    .dependencies(getStringList(data, DEPENDENCIES))
                    .priority(getInt(data, PRIORITY, Task.DEFAULT_PRIORITY))
                    .maxAttempts(getInt(data, MAX_ATTEMPTS, Task.DEFAULT_MAX_ATTEMPTS))
                    .metadata(metadata)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new GraphValidationException("Task '" + id + "': " + e.getMessage(), e);
        }
    }

    private Map<String, Object> load(String content) {
        if (content == null) {
            return null;
        }
        if (looksLikeJson(content)) {
            return loadJson(content);
        }
        try {
            return asMapping(new Yaml().load(content));
        } catch (YAMLException e) {
            throw new GraphValidationException("Malformed graph document: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> load(InputStream inputStream) {
        try {
            return load(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph document", e);
        }
    }

    // JSON allows tab indentation, YAML does not
    private Map<String, Object> loadJson(String content) {
        if (content.isBlank()) {
            return null;
        }
        try {
            return asMapping(objectMapper.readValue(content, Object.class));
        } catch (JsonProcessingException e) {
            throw new GraphValidationException("Malformed graph document: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean looksLikeJson(String content) {
        String trimmed = content.stripLeading();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMapping(Object document) {
        if (document == null) {
            return null;
        }
        if (!(document instanceof Map)) {
            throw new GraphValidationException("Graph document must be a mapping, got " + typeName(document));
        }
        return (Map<String, Object>) document;
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null || value.toString().isBlank()) {
            if (required) {
                throw new GraphValidationException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer number) {
            return number;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            try {
                return new BigInteger(value.toString()).intValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("'" + key + "' is out of range, got " + value);
            }
        }
        if (value instanceof Number) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got '" + value + "'");
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got '" + value + "'");
        }
    }

    private List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(Object::toString)
                    .toList();
        }
        throw new IllegalArgumentException("'" + key + "' must be a list of task ids, got " + typeName(value));
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
