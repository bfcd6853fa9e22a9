package com.matrixwatcher.core.scheduler;

import com.matrixwatcher.core.model.Priority;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registration record of one task inside the {@link Scheduler}.
 *
 * <p>
 * {@code running} is shared with the task that replaces this one under the
 * same name, so a replacement can never start while the previous body is
 * still executing.
 * </p>
 */
final class ScheduledTask {

    private final String name;
    private final TaskHandler handler;
    private final Duration interval;
    private final Priority priority;
    private final Duration timeout;
    private final long sequence;
    private final AtomicBoolean running;
    private final TaskStats stats = new TaskStats();

    private volatile boolean paused;
    private volatile boolean retired;
    private volatile boolean started;
    private volatile long lastStartNanos;
    private volatile CancellationToken currentToken;

    ScheduledTask(String name, TaskHandler handler, Duration interval, Priority priority,
            Duration timeout, long sequence, AtomicBoolean running) {
        this.name = name;
        this.handler = handler;
        this.interval = interval;
        this.priority = priority;
        this.timeout = timeout;
        this.sequence = sequence;
        this.running = running;
    }

    /**
     * A task is ready when it is active, idle and its interval has elapsed
     * since the previous start.
     */
    boolean isReady(long nowNanos) {
        if (paused || retired || running.get()) {
            return false;
        }
        return !started || nowNanos - lastStartNanos >= interval.toNanos();
    }

    /**
     * Claim the task for one execution.
     *
     * @return the token for this execution, or {@code null} if already
     *         running or retired
     */
    CancellationToken tryBegin(long nowNanos) {
        if (retired || !running.compareAndSet(false, true)) {
            return null;
        }
        CancellationToken token = CancellationToken.withTimeout(timeout);
        currentToken = token;
        if (retired) {
            // retired between the check and the claim
            currentToken = null;
            running.set(false);
            return null;
        }
        started = true;
        lastStartNanos = nowNanos;
        return token;
    }

    void end() {
        currentToken = null;
        running.set(false);
    }

    void retire() {
        retired = true;
        cancelCurrent();
    }

    void cancelCurrent() {
        CancellationToken token = currentToken;
        if (token != null) {
            token.cancel();
        }
    }

    synchronized void recordSuccess(Instant startedAt, double durationMs) {
        stats.recordSuccess(startedAt, durationMs);
    }

    synchronized void recordFailure(Instant startedAt, double durationMs, Throwable error) {
        stats.recordFailure(startedAt, durationMs, error);
    }

    synchronized TaskStats statsSnapshot() {
        return stats.copy();
    }

    TaskState state() {
        if (running.get()) {
            return TaskState.RUNNING;
        }
        return paused ? TaskState.PAUSED : TaskState.IDLE;
    }

    String getName() {
        return name;
    }

    TaskHandler getHandler() {
        return handler;
    }

    Duration getInterval() {
        return interval;
    }

    Priority getPriority() {
        return priority;
    }

    long getSequence() {
        return sequence;
    }

    AtomicBoolean runningFlag() {
        return running;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    boolean isPaused() {
        return paused;
    }

    boolean isRetired() {
        return retired;
    }

    @Override
    public String toString() {
        return "ScheduledTask{" + name + ", " + priority.value() + ", every " + interval + '}';
    }
}
