package com.matrixwatcher.core.detection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic snapshot of one sliding window.
 *
 * @since 1.0.0
 */
public final class WindowStats {

    private final int count;
    private final double mean;
    private final double std;

    WindowStats(int count, double mean, double std) {
        this.count = count;
        this.mean = mean;
        this.std = std;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("count", count);
        m.put("mean", mean);
        m.put("std", std);
        return m;
    }

    @Override
    public String toString() {
        return "WindowStats" + toMap();
    }
}
