package org.neuralchilli.acms.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON Lines ledger: one JSON object per line, keys sorted by default.
 * Every entry gets a UTC ISO-8601 {@code timestamp} unless the caller supplied one.
 */
public class JsonlLedger implements Ledger {

    private static final Logger log = LoggerFactory.getLogger(JsonlLedger.class);

    private static final TypeReference<Map<String, Object>> ENTRY_TYPE = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Object lock = new Object();

    public JsonlLedger(Path path) {
        this(path, true);
    }

    public JsonlLedger(Path path, boolean sortKeys) {
        if (path == null) {
            throw new IllegalArgumentException("Ledger path cannot be null");
        }
        this.path = path.toAbsolutePath();
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, sortKeys)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        Path parent = this.path.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create ledger directory: " + parent, e);
            }
        }
        log.debug("Ledger writing to {}", this.path);
    }

    public Path path() {
        return path;
    }

    @Override
    public void record(Map<String, Object> event) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(TIMESTAMP, Instant.now().toString());
        entry.putAll(event);

        String line;
        try {
            line = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger event is not serialisable: " + event, e);
        }

        synchronized (lock) {
            try {
                Files.writeString(
                        path,
                        line + "\n",
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND
                );
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to ledger: " + path, e);
            }
        }
    }

    /**
     * All entries in insertion order; empty when the file does not exist yet.
     */
    public List<Map<String, Object>> entries() {
        List<String> lines;
        synchronized (lock) {
            if (!Files.exists(path)) {
                return List.of();
            }
            try {
                lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read ledger: " + path, e);
            }
        }

        List<Map<String, Object>> entries = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, ENTRY_TYPE));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt ledger line in " + path + ": " + line, e);
            }
        }
        return entries;
    }

    /**
     * The most recent {@code limit} entries.
     */
    public List<Map<String, Object>> tail(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        List<Map<String, Object>> entries = entries();
        return entries.subList(Math.max(0, entries.size() - limit), entries.size());
    }

    /**
     * Erase the ledger contents while keeping the file.
     */
    public void clear() {
        synchronized (lock) {
            try {
                Files.writeString(path, "", StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to clear ledger: " + path, e);
            }
        }
    }
}
