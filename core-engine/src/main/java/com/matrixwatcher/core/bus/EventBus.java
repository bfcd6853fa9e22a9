package com.matrixwatcher.core.bus;

import com.matrixwatcher.core.model.Event;
import com.matrixwatcher.core.model.EventType;
import com.matrixwatcher.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process publish/subscribe bus with per-subscriber filtering.
 *
 * <h3>Delivery</h3>
 * <p>
 * {@link #publish(Event)} runs every matching handler synchronously on the
 * caller's thread. A handler that throws does not affect other subscribers;
 * the event is appended to that subscriber's private buffer of at most
 * {@code maxBufferSize} events. When the buffer is full the oldest entry is
 * evicted and the subscriber's dropped counter is incremented. The buffer only
 * holds failed deliveries.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent publishers and concurrent (un)subscription. Each
 * subscriber receives events in the order their publish calls reached it;
 * there is no ordering across subscribers.
 * </p>
 *
 * @since 1.0.0
 */
public class EventBus {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    /** Default capacity of each subscriber's failed-delivery buffer. */
    public static final int DEFAULT_MAX_BUFFER_SIZE = 1000;

    private final int maxBufferSize;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Map<String, Subscription> byId = new ConcurrentHashMap<>();
    private final AtomicLong totalPublished = new AtomicLong();

    public EventBus() {
        this(DEFAULT_MAX_BUFFER_SIZE);
    }

    /**
     * @param maxBufferSize per-subscriber buffer capacity; must be &gt;= 1
     * @throws IllegalArgumentException if {@code maxBufferSize} &lt; 1
     */
    public EventBus(int maxBufferSize) {
        if (maxBufferSize < 1) {
            throw new IllegalArgumentException("maxBufferSize must be >= 1, got: " + maxBufferSize);
        }
        this.maxBufferSize = maxBufferSize;
    }

    // ---------------------------------------------------------------
    // Subscription management
    // ---------------------------------------------------------------

    /**
     * Subscribe to every event.
     *
     * @param handler callback; must not be {@code null}
     * @return subscription id
     */
    public String subscribe(EventHandler handler) {
        return subscribe(handler, EventFilter.all());
    }

    /**
     * Subscribe with optional criteria; {@code null} means "any".
     *
     * @param handler     callback; must not be {@code null}
     * @param eventTypes  admitted event types
     * @param sources     admitted sources
     * @param minSeverity lowest admitted severity
     * @return subscription id
     */
    public String subscribe(EventHandler handler, Collection<EventType> eventTypes,
            Collection<String> sources, Severity minSeverity) {
        return subscribe(handler, EventFilter.of(eventTypes, sources, minSeverity));
    }

    /**
     * @param handler callback; must not be {@code null}
     * @param filter  criteria; must not be {@code null}
     * @return subscription id
     */
    public String subscribe(EventHandler handler, EventFilter filter) {
        Objects.requireNonNull(handler, "EventHandler must not be null");
        Objects.requireNonNull(filter, "EventFilter must not be null");
        String id = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(id, handler, filter, maxBufferSize);
        byId.put(id, subscription);
        subscriptions.add(subscription);
        LOG.debug("Subscriber {} registered with {}", id, filter);
        return id;
    }

    /**
     * @param subscriptionId id returned by {@code subscribe}
     * @return {@code true} if the subscription existed
     */
    public boolean unsubscribe(String subscriptionId) {
        if (subscriptionId == null) {
            return false;
        }
        Subscription removed = byId.remove(subscriptionId);
        if (removed == null) {
            return false;
        }
        subscriptions.remove(removed);
        LOG.debug("Subscriber {} removed", subscriptionId);
        return true;
    }

    // ---------------------------------------------------------------
    // Publishing
    // ---------------------------------------------------------------

    /**
     * Deliver an event to every matching subscriber. Never throws because of a
     * handler failure.
     *
     * @param event the event; must not be {@code null}
     */
    public void publish(Event event) {
        Objects.requireNonNull(event, "Event must not be null");
        totalPublished.incrementAndGet();

        for (Subscription subscription : subscriptions) {
            if (!subscription.getFilter().matches(event)) {
                continue;
            }
            Throwable failure = subscription.deliver(event);
            if (failure != null) {
                LOG.warn("Subscriber {} failed to handle {} event from '{}' - buffered",
                        subscription.getId(), event.getEventType().value(), event.getSource(), failure);
            }
        }
    }

    // ---------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------

    /**
     * @return events evicted from the subscriber's buffer, 0 for unknown ids
     */
    public long getDroppedCount(String subscriptionId) {
        Subscription s = lookup(subscriptionId);
        return s == null ? 0 : s.getDropped();
    }

    /**
     * @return current failed-delivery buffer size, 0 for unknown ids
     */
    public int getBufferSize(String subscriptionId) {
        Subscription s = lookup(subscriptionId);
        return s == null ? 0 : s.getBufferSize();
    }

    /**
     * @return oldest-first copy of the subscriber's buffered events
     */
    public List<Event> getBufferedEvents(String subscriptionId) {
        Subscription s = lookup(subscriptionId);
        return s == null ? Collections.emptyList() : s.snapshotBuffer();
    }

    /**
     * Remove and return the subscriber's buffered events, e.g. for a retry.
     *
     * @return oldest-first buffered events
     */
    public List<Event> drainBuffer(String subscriptionId) {
        Subscription s = lookup(subscriptionId);
        return s == null ? Collections.emptyList() : s.drainBuffer();
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    public int getMaxBufferSize() {
        return maxBufferSize;
    }

    /**
     * @return point-in-time statistics
     */
    public BusStats getStats() {
        long delivered = 0;
        long dropped = 0;
        long buffered = 0;
        int count = 0;
        for (Subscription s : subscriptions) {
            delivered += s.getDelivered();
            dropped += s.getDropped();
            buffered += s.getBufferSize();
            count++;
        }
        return new BusStats(count, totalPublished.get(), delivered, dropped, buffered);
    }

    /**
     * Remove every subscription and reset counters.
     */
    public void clear() {
        subscriptions.clear();
        byId.clear();
        totalPublished.set(0);
        LOG.debug("Event bus cleared");
    }

    private Subscription lookup(String subscriptionId) {
        return subscriptionId == null ? null : byId.get(subscriptionId);
    }
}
