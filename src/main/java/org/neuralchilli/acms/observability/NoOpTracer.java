package org.neuralchilli.acms.observability;

import java.util.Map;

/**
 * Tracer used when tracing is disabled or no tracer was supplied.
 */
public final class NoOpTracer implements Tracer {

    public static final NoOpTracer INSTANCE = new NoOpTracer();

    private static final Span NO_OP_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void recordError(Throwable error) {
        }

        @Override
        public void close() {
        }
    };

    private NoOpTracer() {
    }

    @Override
    public Span startSpan(String name, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }
}
