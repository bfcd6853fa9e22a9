/**
 * In-process event bus.
 *
 * <p>
 * Producers call {@link com.matrixwatcher.core.bus.EventBus#publish}; consumers
 * register an {@link com.matrixwatcher.core.bus.EventHandler} with an optional
 * {@link com.matrixwatcher.core.bus.EventFilter}. Handler failures are
 * contained and buffered per subscriber.
 * </p>
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.bus;
