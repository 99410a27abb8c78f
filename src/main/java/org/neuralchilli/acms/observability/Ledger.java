package org.neuralchilli.acms.observability;

import java.util.Map;

/**
 * Append-only audit sink for state transitions.
 * Implementations must be safe for concurrent appends and must not throw on well-formed input.
 */
public interface Ledger {

    String EVENT_TYPE = "event_type";
    String TIMESTAMP = "timestamp";

    /**
     * Append one event.
     */
    void record(Map<String, Object> event);

    /**
     * Ledger that discards every event.
     */
    static Ledger discarding() {
        return event -> { };
    }
}
