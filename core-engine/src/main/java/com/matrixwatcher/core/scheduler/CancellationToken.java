package com.matrixwatcher.core.scheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Cooperative stop signal handed to every {@link TaskHandler} execution.
 *
 * <p>
 * Unregister and replacement do not interrupt a running handler. The
 * scheduler cancels the token when the task is unregistered, replaced or the
 * scheduler stops; an optional
 * deadline expires the token on its own. Long-running handlers should poll
 * {@link #shouldStop()} between blocking steps.
 * </p>
 *
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long deadlineNanos;
    private volatile boolean cancelled;

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * @return a token that only ends through {@link #cancel()}
     */
    public static CancellationToken create() {
        return new CancellationToken(NO_DEADLINE);
    }

    /**
     * @param timeout time limit from now; {@code null} for none
     * @return a token that also expires after {@code timeout}
     */
    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null) {
            return create();
        }
        return new CancellationToken(System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @return {@code true} once the deadline has passed
     */
    public boolean isExpired() {
        return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * @return {@code true} if the handler should return as soon as possible
     */
    public boolean shouldStop() {
        return cancelled || isExpired();
    }

    /**
     * @return time left before the deadline, or empty without one
     */
    public Optional<Duration> remaining() {
        if (deadlineNanos == NO_DEADLINE) {
            return Optional.empty();
        }
        long left = deadlineNanos - System.nanoTime();
        return Optional.of(Duration.ofNanos(Math.max(0, left)));
    }

    /**
     * @throws CancellationException if {@link #shouldStop()} is {@code true}
     */
    public void throwIfStopRequested() {
        if (cancelled) {
            throw new CancellationException("Task cancelled");
        }
        if (isExpired()) {
            throw new CancellationException("Task deadline exceeded");
        }
    }
}
