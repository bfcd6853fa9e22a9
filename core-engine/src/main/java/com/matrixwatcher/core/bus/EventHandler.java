package com.matrixwatcher.core.bus;

import com.matrixwatcher.core.model.Event;

/**
 * Callback invoked by the {@link EventBus} for every matching event.
 *
 * <p>
 * Implementations may throw; the bus contains the failure and buffers the
 * event for that subscriber.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * @param event the delivered event
     * @throws Exception if the event could not be handled
     */
    void handle(Event event) throws Exception;
}
