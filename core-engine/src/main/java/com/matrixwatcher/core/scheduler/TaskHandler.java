package com.matrixwatcher.core.scheduler;

/**
 * Body of a repeating task.
 *
 * <p>
 * Only {@link Scheduler#stop()} interrupts a running handler, and only after
 * its grace period. Until then a handler that blocks without checking its
 * {@link CancellationToken} keeps its worker thread.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Run one execution.
     *
     * @param token stop signal for this execution; check it between blocking
     *              steps
     * @throws Exception any failure; recorded in {@link TaskStats}
     */
    void run(CancellationToken token) throws Exception;
}
