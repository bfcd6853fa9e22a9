package com.matrixwatcher.runtime;

import com.matrixwatcher.core.model.SensorReading;
import com.matrixwatcher.core.scheduler.CancellationToken;

import java.util.List;

/**
 * Source of sensor readings polled by {@link MatrixWatcher}.
 *
 * <p>
 * Implementations may block on network I/O; they should check the token
 * between blocking steps and return early once it is cancelled.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SensorCollector {

    /**
     * Fetch the readings available now.
     *
     * @param token stop signal for this poll
     * @return readings in the order they should be processed; may be empty
     * @throws Exception on a failed fetch; counted against the sensor task
     */
    List<SensorReading> collect(CancellationToken token) throws Exception;
}
