package org.neuralchilli.acms.observability;

import java.util.Map;

/**
 * Span-recording collaborator. Spans are scoped resources:
 * <pre>{@code
 * try (Tracer.Span span = tracer.startSpan("task.attempt", Map.of("task_id", id))) {
 *     ...
 * }
 * }</pre>
 */
public interface Tracer {

    /**
     * Start a span; the caller closes it when the scope ends.
     */
    Span startSpan(String name, Map<String, String> attributes);

    default Span startSpan(String name) {
        return startSpan(name, Map.of());
    }

    /**
     * An open span. Closing twice has no further effect.
     */
    interface Span extends AutoCloseable {

        void setAttribute(String key, String value);

        /**
         * Mark the span as failed.
         */
        void recordError(Throwable error);

        @Override
        void close();
    }
}
