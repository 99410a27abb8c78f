package org.neuralchilli.acms.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracer that records every span as a Micrometer timer sample.
 * Timers are tagged by span name and outcome only; span attributes go to the
 * trace log so that task ids do not explode meter cardinality.
 */
public class MeterTracer implements Tracer {

    private static final Logger log = LoggerFactory.getLogger(MeterTracer.class);

    public static final String SPAN_TIMER = "acms.span.duration";

    private final MeterRegistry registry;

    public MeterTracer(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Meter registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public Span startSpan(String name, Map<String, String> attributes) {
        log.trace("Span started: {} {}", name, attributes);
        return new MeterSpan(name, attributes);
    }

    private final class MeterSpan implements Span {

        private final String name;
        private final Map<String, String> attributes;
        private final Timer.Sample sample;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile Throwable error;

        private MeterSpan(String name, Map<String, String> attributes) {
            this.name = name;
            this.attributes = new LinkedHashMap<>(attributes);
            this.sample = Timer.start(registry);
        }

        @Override
        public synchronized void setAttribute(String key, String value) {
            attributes.put(key, value);
        }

        @Override
        public void recordError(Throwable error) {
            this.error = error;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            long nanos = sample.stop(Timer.builder(SPAN_TIMER)
                    .description("Duration of orchestration spans")
                    .tag("span", name)
                    .tag("outcome", error == null ? "ok" : "error")
                    .register(registry));
            if (log.isTraceEnabled()) {
                synchronized (this) {
                    log.trace("Span finished: {} {} in {}ms", name, attributes, nanos / 1_000_000);
                }
            }
        }
    }
}
