package com.matrixwatcher.core.scheduler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution history of one task.
 *
 * <p>
 * Instances handed out by the {@link Scheduler} are snapshots; the live copy
 * is mutated only by the worker that finished an execution, under the owning
 * task's lock.
 * </p>
 *
 * @since 1.0.0
 */
public final class TaskStats {

    private long runCount;
    private long errorCount;
    private int consecutiveFailures;
    private Instant lastRun;
    private double avgDurationMs;
    private double lastDurationMs;
    private String lastError;

    TaskStats() {
    }

    private TaskStats(TaskStats other) {
        this.runCount = other.runCount;
        this.errorCount = other.errorCount;
        this.consecutiveFailures = other.consecutiveFailures;
        this.lastRun = other.lastRun;
        this.avgDurationMs = other.avgDurationMs;
        this.lastDurationMs = other.lastDurationMs;
        this.lastError = other.lastError;
    }

    void recordSuccess(Instant startedAt, double durationMs) {
        recordRun(startedAt, durationMs);
        consecutiveFailures = 0;
    }

    void recordFailure(Instant startedAt, double durationMs, Throwable error) {
        recordRun(startedAt, durationMs);
        errorCount++;
        consecutiveFailures++;
        lastError = error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private void recordRun(Instant startedAt, double durationMs) {
        runCount++;
        lastRun = startedAt;
        lastDurationMs = durationMs;
        avgDurationMs += (durationMs - avgDurationMs) / runCount;
    }

    TaskStats copy() {
        return new TaskStats(this);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return completed execution attempts, successful or not
     */
    public long getRunCount() {
        return runCount;
    }

    public long getErrorCount() {
        return errorCount;
    }

    /**
     * @return failures since the last successful run
     */
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * @return start time of the latest completed execution, or {@code null}
     */
    public Instant getLastRun() {
        return lastRun;
    }

    public double getAvgDurationMs() {
        return avgDurationMs;
    }

    public double getLastDurationMs() {
        return lastDurationMs;
    }

    public String getLastError() {
        return lastError;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("run_count", runCount);
        m.put("error_count", errorCount);
        m.put("consecutive_failures", consecutiveFailures);
        m.put("last_run", lastRun != null ? lastRun.toString() : null);
        m.put("avg_duration_ms", avgDurationMs);
        m.put("last_error", lastError);
        return m;
    }

    @Override
    public String toString() {
        return "TaskStats" + toMap();
    }
}
