package com.matrixwatcher.core.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plain-data snapshot of a {@link HistoricalPatternTracker}.
 *
 * <p>
 * {@code patterns} maps condition key to event type to the
 * {@link Pattern#toMap()} form. Each entry of {@code recentConditions} is a
 * {@link Condition#toMap()} plus a {@value #MATCHED_EVENTS} list.
 * {@code priceHistory} maps asset to the samples exported by
 * {@link com.matrixwatcher.core.rules.PriceHistory#exportSince}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrackerState {

    public static final String MATCHED_EVENTS = "matched_events";

    private final Map<String, Map<String, Map<String, Object>>> patterns;
    private final List<Map<String, Object>> recentConditions;
    private final Map<String, List<Map<String, Object>>> priceHistory;

    public TrackerState(Map<String, Map<String, Map<String, Object>>> patterns,
            List<Map<String, Object>> recentConditions) {
        this(patterns, recentConditions, Collections.emptyMap());
    }

    public TrackerState(Map<String, Map<String, Map<String, Object>>> patterns,
            List<Map<String, Object>> recentConditions,
            Map<String, List<Map<String, Object>>> priceHistory) {
        this.patterns = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(patterns, "patterns must not be null")));
        this.recentConditions = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(recentConditions, "recentConditions must not be null")));
        this.priceHistory = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(priceHistory, "priceHistory must not be null")));
    }

    public static TrackerState empty() {
        return new TrackerState(Collections.emptyMap(), Collections.emptyList(), Collections.emptyMap());
    }

    public Map<String, Map<String, Map<String, Object>>> getPatterns() {
        return patterns;
    }

    public List<Map<String, Object>> getRecentConditions() {
        return recentConditions;
    }

    public Map<String, List<Map<String, Object>>> getPriceHistory() {
        return priceHistory;
    }

    public boolean isEmpty() {
        return patterns.isEmpty() && recentConditions.isEmpty() && priceHistory.isEmpty();
    }
}
