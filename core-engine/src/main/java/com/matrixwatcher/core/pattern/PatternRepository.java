package com.matrixwatcher.core.pattern;

import java.io.IOException;

/**
 * Storage for the tracker's learned state.
 *
 * <p>
 * The tracker only produces and consumes {@link TrackerState}; the storage
 * format is the implementation's choice.
 * </p>
 *
 * @since 1.0.0
 */
public interface PatternRepository {

    /**
     * @return the stored state, or an empty state if nothing was stored yet
     * @throws IOException if stored data exists but cannot be read
     */
    TrackerState load() throws IOException;

    void save(TrackerState state) throws IOException;
}
