package org.neuralchilli.acms.observability;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters for orchestration runs.
 *
 * Tracks:
 * - runs started / succeeded / aborted
 * - task attempts, retries, completions, exhausted failures and cancellations
 * - lifecycle hook and ledger failures
 * - per-operation timings (run, wave, task)
 */
@ApplicationScoped
public class OrchestrationMonitor {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationMonitor.class);

    // Run metrics
    private final LongAdder runsStarted = new LongAdder();
    private final LongAdder runsSucceeded = new LongAdder();
    private final LongAdder runsAborted = new LongAdder();

    // Task metrics
    private final LongAdder taskAttempts = new LongAdder();
    private final LongAdder taskRetries = new LongAdder();
    private final LongAdder tasksCompleted = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();
    private final LongAdder tasksCancelled = new LongAdder();

    // Collaborator failures
    private final LongAdder hookFailures = new LongAdder();
    private final LongAdder ledgerFailures = new LongAdder();

    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public void recordRunStarted() {
        runsStarted.increment();
    }

    public void recordRunSucceeded() {
        runsSucceeded.increment();
    }

    public void recordRunAborted() {
        runsAborted.increment();
    }

    public void recordTaskAttempt() {
        taskAttempts.increment();
    }

    public void recordTaskRetry() {
        taskRetries.increment();
    }

    public void recordTaskCompleted() {
        tasksCompleted.increment();
    }

    /**
     * Record a task that exhausted its retry budget.
     */
    public void recordTaskFailed() {
        tasksFailed.increment();
    }

    public void recordTaskCancelled() {
        tasksCancelled.increment();
    }

    public void recordHookFailure() {
        hookFailures.increment();
    }

    public void recordLedgerFailure() {
        ledgerFailures.increment();
    }

    /**
     * Get task success rate over finished tasks.
     */
    public double getTaskSuccessRate() {
        long completed = tasksCompleted.sum();
        long failed = tasksFailed.sum();
        long total = completed + failed;
        return total > 0 ? (completed * 100.0) / total : 0.0;
    }

    /**
     * Start timing an operation.
     *
     * @param operation Operation name
     * @return Timer handle to stop timing
     */
    public Timer startTimer(String operation) {
        return new Timer(operation, Instant.now());
    }

    /**
     * Timer handle for operation timing.
     */
    public class Timer {
        private final String operation;
        private final Instant start;

        private Timer(String operation, Instant start) {
            this.operation = operation;
            this.start = start;
        }

        /**
         * Stop timing and record duration.
         */
        public Duration stop() {
            Duration duration = Duration.between(start, Instant.now());
            recordTiming(operation, duration);
            return duration;
        }
    }

    private void recordTiming(String operation, Duration duration) {
        timingStats.computeIfAbsent(operation, key -> new TimingStats()).record(duration);
    }

    /**
     * Get timing statistics for an operation.
     */
    public TimingStats getTimingStats(String operation) {
        return timingStats.getOrDefault(operation, new TimingStats());
    }

    /**
     * Statistics for operation timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            minNanos.updateAndGet(current -> Math.min(current, nanos));
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long total = totalNanos.sum();
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(total / cnt) : Duration.ZERO;
        }

        public Duration getMin() {
            long min = minNanos.get();
            return min < Long.MAX_VALUE ? Duration.ofNanos(min) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format(
                    "TimingStats[count=%d, avg=%dms, min=%dms, max=%dms]",
                    getCount(),
                    getAverage().toMillis(),
                    getMin().toMillis(),
                    getMax().toMillis()
            );
        }
    }

    /**
     * Snapshot of all counters.
     */
    public Report getReport() {
        return new Report(
                runsStarted.sum(),
                runsSucceeded.sum(),
                runsAborted.sum(),
                taskAttempts.sum(),
                taskRetries.sum(),
                tasksCompleted.sum(),
                tasksFailed.sum(),
                tasksCancelled.sum(),
                getTaskSuccessRate(),
                hookFailures.sum(),
                ledgerFailures.sum()
        );
    }

    public record Report(
            long runsStarted,
            long runsSucceeded,
            long runsAborted,
            long taskAttempts,
            long taskRetries,
            long tasksCompleted,
            long tasksFailed,
            long tasksCancelled,
            double taskSuccessRate,
            long hookFailures,
            long ledgerFailures
    ) {
        @Override
        public String toString() {
            return String.format("""
                Orchestration Report:
                =====================
                Runs:
                  Started: %d, Succeeded: %d, Aborted: %d

                Tasks:
                  Success Rate: %.1f%%
                  Attempts: %d, Retries: %d
                  Completed: %d, Failed: %d, Cancelled: %d

                Collaborators:
                  Hook failures: %d, Ledger failures: %d
                """,
                    runsStarted, runsSucceeded, runsAborted,
                    taskSuccessRate,
                    taskAttempts, taskRetries,
                    tasksCompleted, tasksFailed, tasksCancelled,
                    hookFailures, ledgerFailures
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        runsStarted.reset();
        runsSucceeded.reset();
        runsAborted.reset();
        taskAttempts.reset();
        taskRetries.reset();
        tasksCompleted.reset();
        tasksFailed.reset();
        tasksCancelled.reset();
        hookFailures.reset();
        ledgerFailures.reset();
        timingStats.clear();
        log.info("Orchestration metrics reset");
    }

    /**
     * Log current report.
     */
    public void logReport() {
        log.info("\n{}", getReport());
    }
}
