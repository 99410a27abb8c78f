package org.neuralchilli.acms.observability;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonlLedgerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendOneSortedJsonObjectPerLine() throws IOException {
        JsonlLedger ledger = new JsonlLedger(tempDir.resolve("nested/dir/ledger.jsonl"));

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("task_id", "A");
        event.put("event_type", "task_terminal");
        event.put("attempt", 1);
        ledger.record(event);
        ledger.record(Map.of("event_type", "workflow_finished"));

        List<String> lines = Files.readAllLines(ledger.path(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("{\"attempt\":1,\"event_type\":\"task_terminal\",\"task_id\":\"A\"");
        assertThat(lines.get(0)).contains("\"timestamp\":");
    }

    @Test
    void shouldKeepInsertionOrderWhenSortingDisabled() throws IOException {
        JsonlLedger ledger = new JsonlLedger(tempDir.resolve("ledger.jsonl"), false);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("z", 1);
        event.put("a", 2);
        ledger.record(event);

        String line = Files.readAllLines(ledger.path(), StandardCharsets.UTF_8).get(0);
        assertThat(line).startsWith("{\"timestamp\":");
        assertThat(line.indexOf("\"z\"")).isLessThan(line.indexOf("\"a\""));
    }

    @Test
    void shouldStampUtcTimestamp() {
        JsonlLedger ledger = new JsonlLedger(tempDir.resolve("ledger.jsonl"));
        Instant before = Instant.now();

        ledger.record(Map.of("event_type", "x"));

        String timestamp = (String) ledger.entries().get(0).get(Ledger.TIMESTAMP);
        assertThat(timestamp).endsWith("Z");
        assertThat(Instant.parse(timestamp)).isAfterOrEqualTo(before.minusMillis(1));
    }

    @Test
    void shouldReadBackEntriesAndTail() {
        JsonlLedger ledger = new JsonlLedger(tempDir.resolve("ledger.jsonl"));
        for (int i = 0; i < 5; i++) {
            ledger.record(Map.of("seq", i));
        }

        assertThat(ledger.entries()).extracting(entry -> entry.get("seq")).containsExactly(0, 1, 2, 3, 4);
        assertThat(ledger.tail(2)).extracting(entry -> entry.get("seq")).containsExactly(3, 4);
        assertThat(ledger.tail(10)).hasSize(5);
        assertThat(ledger.tail(0)).isEmpty();
        assertThatThrownBy(() -> ledger.tail(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReturnNoEntriesBeforeFirstWrite() {
        JsonlLedger ledger = new JsonlLedger(tempDir.resolve("fresh.jsonl"));

        assertThat(ledger.entries()).isEmpty();
    }

    @Test
    void shouldClearContents() {
        JsonlLedger ledger = new JsonlLedger(tempDir.resolve("ledger.jsonl"));
        ledger.record(Map.of("seq", 1));

        ledger.clear();

        assertThat(ledger.entries()).isEmpty();
        assertThat(Files.exists(ledger.path())).isTrue();
    }

    @Test
    void shouldNotInterleaveConcurrentAppends() throws InterruptedException {
        JsonlLedger ledger = new JsonlLedger(tempDir.resolve("ledger.jsonl"));
        ExecutorService pool = Executors.newFixedThreadPool(8);

        for (int t = 0; t < 8; t++) {
            int thread = t;
            pool.submit(() -> {
                for (int i = 0; i < 50; i++) {
                    ledger.record(Map.of("thread", thread, "seq", i, "payload", "x".repeat(200)));
                }
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(ledger.entries()).hasSize(400);
    }

    static class Unreadable {
        public String getValue() {
            throw new IllegalStateException("no value");
        }
    }

    @Test
    void shouldRejectUnserialisableEvent() {
        JsonlLedger ledger = new JsonlLedger(tempDir.resolve("ledger.jsonl"));
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("payload", new Unreadable());

        assertThatThrownBy(() -> ledger.record(event))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not serialisable");
    }
}
