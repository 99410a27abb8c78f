package org.neuralchilli.acms.observability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger kept in memory, in insertion order.
 * Intended for embedding and tests; contents are lost with the process.
 */
public class InMemoryLedger implements Ledger {

    private final List<Map<String, Object>> entries = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void record(Map<String, Object> event) {
        entries.add(Collections.unmodifiableMap(new LinkedHashMap<>(event)));
    }

    /**
     * Copy of all recorded events.
     */
    public List<Map<String, Object>> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    /**
     * Recorded events of one type.
     */
    public List<Map<String, Object>> entries(String eventType) {
        return entries().stream()
                .filter(entry -> eventType.equals(entry.get(EVENT_TYPE)))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
