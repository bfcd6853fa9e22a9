package com.matrixwatcher.core.bus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of {@link EventBus} counters.
 *
 * @since 1.0.0
 */
public final class BusStats {

    private final int subscriberCount;
    private final long totalPublished;
    private final long totalDelivered;
    private final long totalDropped;
    private final long totalBuffered;

    BusStats(int subscriberCount, long totalPublished, long totalDelivered,
            long totalDropped, long totalBuffered) {
        this.subscriberCount = subscriberCount;
        this.totalPublished = totalPublished;
        this.totalDelivered = totalDelivered;
        this.totalDropped = totalDropped;
        this.totalBuffered = totalBuffered;
    }

    public int getSubscriberCount() {
        return subscriberCount;
    }

    public long getTotalPublished() {
        return totalPublished;
    }

    /**
     * @return successful deliveries summed over current subscribers
     */
    public long getTotalDelivered() {
        return totalDelivered;
    }

    public long getTotalDropped() {
        return totalDropped;
    }

    public long getTotalBuffered() {
        return totalBuffered;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("subscriber_count", subscriberCount);
        m.put("total_published", totalPublished);
        m.put("total_delivered", totalDelivered);
        m.put("total_dropped", totalDropped);
        m.put("total_buffered", totalBuffered);
        return m;
    }

    @Override
    public String toString() {
        return "BusStats" + toMap();
    }
}
