package com.matrixwatcher.core.pattern;

import com.matrixwatcher.core.model.Payloads;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Learned statistics for one (condition key, event type) pair.
 *
 * <p>
 * Times are in seconds. {@code minTimeToEvent} is positive infinity until the
 * first match and round-trips through {@link #toMap()} as {@code null}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; owned by {@link HistoricalPatternTracker}, which hands out
 * copies.
 * </p>
 *
 * @since 1.0.0
 */
public final class Pattern {

    private final String conditionKey;
    private final String eventType;

    private long conditionCount;
    private long eventAfterCount;

    private double avgTimeToEvent;
    private double minTimeToEvent = Double.POSITIVE_INFINITY;
    private double maxTimeToEvent;

    private double predictedProbability;
    private double actualProbability;
    private double brierScore;

    private final List<GeoPoint> eventLocations = new ArrayList<>();

    public Pattern(String conditionKey, String eventType) {
        this.conditionKey = Objects.requireNonNull(conditionKey, "conditionKey must not be null");
        this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
    }

    // ---------------------------------------------------------------
    // Updates
    // ---------------------------------------------------------------

    void incrementConditionCount() {
        conditionCount++;
        updateProbability();
    }

    /**
     * Record one matched condition.
     *
     * @param secondsToEvent time from condition to event
     * @param location       event location, or {@code null}
     * @param maxLocations   cap on retained locations; oldest dropped first
     */
    void recordEvent(double secondsToEvent, GeoPoint location, int maxLocations) {
        eventAfterCount++;
        if (location != null) {
            eventLocations.add(location);
            int excess = eventLocations.size() - maxLocations;
            if (excess > 0) {
                eventLocations.subList(0, excess).clear();
            }
        }
        if (secondsToEvent < minTimeToEvent) {
            minTimeToEvent = secondsToEvent;
        }
        if (secondsToEvent > maxTimeToEvent) {
            maxTimeToEvent = secondsToEvent;
        }
        avgTimeToEvent = (avgTimeToEvent * (eventAfterCount - 1) + secondsToEvent) / eventAfterCount;
        updateProbability();
    }

    /**
     * {@code actual = min(1, eventAfter / condition)}, or 0 without
     * conditions.
     */
    void updateProbability() {
        actualProbability = conditionCount > 0
                ? Math.min(1.0, (double) eventAfterCount / conditionCount)
                : 0.0;
    }

    /**
     * {@code brier = (predicted - actual)^2}.
     */
    void updateBrierScore() {
        if (conditionCount > 0) {
            double diff = predictedProbability - actualProbability;
            brierScore = diff * diff;
        }
    }

    void setPredictedProbability(double predictedProbability) {
        this.predictedProbability = predictedProbability;
    }

    Pattern copy() {
        Pattern p = new Pattern(conditionKey, eventType);
        p.conditionCount = conditionCount;
        p.eventAfterCount = eventAfterCount;
        p.avgTimeToEvent = avgTimeToEvent;
        p.minTimeToEvent = minTimeToEvent;
        p.maxTimeToEvent = maxTimeToEvent;
        p.predictedProbability = predictedProbability;
        p.actualProbability = actualProbability;
        p.brierScore = brierScore;
        p.eventLocations.addAll(eventLocations);
        return p;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getConditionKey() {
        return conditionKey;
    }

    public String getEventType() {
        return eventType;
    }

    public long getConditionCount() {
        return conditionCount;
    }

    public long getEventAfterCount() {
        return eventAfterCount;
    }

    public double getAvgTimeToEvent() {
        return avgTimeToEvent;
    }

    /**
     * @return shortest observed lead time, or {@code +Infinity} if never
     *         matched
     */
    public double getMinTimeToEvent() {
        return minTimeToEvent;
    }

    public double getMaxTimeToEvent() {
        return maxTimeToEvent;
    }

    public double getPredictedProbability() {
        return predictedProbability;
    }

    public double getActualProbability() {
        return actualProbability;
    }

    public double getBrierScore() {
        return brierScore;
    }

    public List<GeoPoint> getEventLocations() {
        return Collections.unmodifiableList(eventLocations);
    }

    // ---------------------------------------------------------------
    // Plain-map conversion
    // ---------------------------------------------------------------

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("condition_key", conditionKey);
        m.put("event_type", eventType);
        m.put("condition_count", conditionCount);
        m.put("event_after_count", eventAfterCount);
        m.put("avg_time_to_event", avgTimeToEvent);
        m.put("min_time_to_event", Double.isInfinite(minTimeToEvent) ? null : minTimeToEvent);
        m.put("max_time_to_event", maxTimeToEvent);
        m.put("predicted_probability", predictedProbability);
        m.put("actual_probability", actualProbability);
        m.put("brier_score", brierScore);
        List<List<Double>> locations = new ArrayList<>(eventLocations.size());
        for (GeoPoint p : eventLocations) {
            locations.add(p.toList());
        }
        m.put("event_locations", locations);
        return m;
    }

    /**
     * Rebuild from {@link #toMap()} output. A missing or {@code null}
     * {@code min_time_to_event} becomes {@code +Infinity}.
     *
     * @param conditionKey key used when the map lacks one
     * @param eventType    type used when the map lacks one
     */
    public static Pattern fromMap(String conditionKey, String eventType, Map<String, Object> map) {
        Objects.requireNonNull(map, "map must not be null");
        Pattern p = new Pattern(
                Payloads.string(map, "condition_key").orElse(conditionKey),
                Payloads.string(map, "event_type").orElse(eventType));
        p.conditionCount = Payloads.number(map, "condition_count").orElse(0.0).longValue();
        p.eventAfterCount = Payloads.number(map, "event_after_count").orElse(0.0).longValue();
        p.avgTimeToEvent = Payloads.number(map, "avg_time_to_event").orElse(0.0);
        p.minTimeToEvent = Payloads.number(map, "min_time_to_event").orElse(Double.POSITIVE_INFINITY);
        p.maxTimeToEvent = Payloads.number(map, "max_time_to_event").orElse(0.0);
        p.predictedProbability = Payloads.number(map, "predicted_probability").orElse(0.0);
        p.actualProbability = Payloads.number(map, "actual_probability").orElse(0.0);
        p.brierScore = Payloads.number(map, "brier_score").orElse(0.0);
        for (Object entry : Payloads.list(map, "event_locations")) {
            if (entry instanceof List<?> pair && pair.size() >= 2) {
                Double lat = Payloads.number(pair.get(0)).orElse(null);
                Double lon = Payloads.number(pair.get(1)).orElse(null);
                if (lat != null && lon != null) {
                    p.eventLocations.add(new GeoPoint(lat, lon));
                }
            }
        }
        return p;
    }

    public static Pattern fromMap(Map<String, Object> map) {
        return fromMap(null, null, map);
    }

    @Override
    public String toString() {
        return "Pattern{" + conditionKey + " -> " + eventType
                + ", conditions=" + conditionCount + ", events=" + eventAfterCount
                + ", p=" + actualProbability + '}';
    }
}
