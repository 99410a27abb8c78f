package org.neuralchilli.acms.observability;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class InMemoryLedgerTest {

    @Test
    void shouldKeepEventsInOrder() {
        InMemoryLedger ledger = new InMemoryLedger();

        ledger.record(Map.of(Ledger.EVENT_TYPE, "workflow_started"));
        ledger.record(Map.of(Ledger.EVENT_TYPE, "task_terminal", "task_id", "a"));
        ledger.record(Map.of(Ledger.EVENT_TYPE, "task_terminal", "task_id", "b"));

        assertThat(ledger.size()).isEqualTo(3);
        assertThat(ledger.entries("task_terminal"))
                .extracting(entry -> entry.get("task_id"))
                .containsExactly("a", "b");
    }

    @Test
    void shouldCopyRecordedEvents() {
        InMemoryLedger ledger = new InMemoryLedger();
        Map<String, Object> event = new HashMap<>();
        event.put("state", "RUNNING");

        ledger.record(event);
        event.put("state", "COMPLETED");

        assertThat(ledger.entries().get(0)).containsEntry("state", "RUNNING");
    }

    @Test
    void shouldClear() {
        InMemoryLedger ledger = new InMemoryLedger();
        ledger.record(Map.of("a", 1));

        ledger.clear();

        assertThat(ledger.entries()).isEmpty();
    }

    @Test
    void shouldDiscardSilently() {
        assertThatCode(() -> Ledger.discarding().record(Map.of("a", 1))).doesNotThrowAnyException();
    }
}
