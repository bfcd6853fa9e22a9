package com.matrixwatcher.core.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Severity score of one cluster on a 0-100 scale.
 *
 * @since 1.0.0
 */
public final class AnomalyIndex {

    private final double index;
    private final String status;
    private final double baselineRatio;
    private final Map<String, Double> breakdown;

    AnomalyIndex(double index, String status, double baselineRatio, Map<String, Double> breakdown) {
        this.index = index;
        this.status = status;
        this.baselineRatio = baselineRatio;
        this.breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }

    public double getIndex() {
        return index;
    }

    /**
     * @return {@code normal}, {@code elevated}, {@code high} or
     *         {@code critical}
     */
    public String getStatus() {
        return status;
    }

    /**
     * @return index relative to the rolling baseline; 1.0 without history
     */
    public double getBaselineRatio() {
        return baselineRatio;
    }

    /**
     * @return contribution per source, in order of first appearance
     */
    public Map<String, Double> getBreakdown() {
        return breakdown;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("index", index);
        m.put("status", status);
        m.put("baseline_ratio", baselineRatio);
        m.put("breakdown", new LinkedHashMap<>(breakdown));
        return m;
    }

    @Override
    public String toString() {
        return "AnomalyIndex{" + index + " (" + status + "), baseline x" + baselineRatio + '}';
    }
}
