package com.matrixwatcher.core.cluster;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Estimates how likely a set of sources is to show anomalies together by
 * chance, assuming independence.
 *
 * <p>
 * Each source's rate is its share of clustering windows that contained an
 * anomaly over a trailing horizon: {@code count * window / horizon}, capped at
 * 1. A source without history uses {@code baseRate}. The estimate is the
 * product of the rates, in percent. It is informational only.
 * </p>
 *
 * @since 1.0.0
 */
public final class CoOccurrenceEstimator {

    public static final double DEFAULT_BASE_RATE = 0.05;
    public static final Duration DEFAULT_HORIZON = Duration.ofHours(1);

    private final double baseRate;
    private final Duration horizon;
    private final Map<String, Deque<Instant>> history = new HashMap<>();

    public CoOccurrenceEstimator() {
        this(DEFAULT_BASE_RATE, DEFAULT_HORIZON);
    }

    /**
     * @param baseRate rate assumed for a source without history, in (0, 1]
     * @param horizon  trailing period used to measure rates
     */
    public CoOccurrenceEstimator(double baseRate, Duration horizon) {
        if (!(baseRate > 0 && baseRate <= 1)) {
            throw new IllegalArgumentException("baseRate must be in (0, 1], got: " + baseRate);
        }
        if (horizon == null || horizon.isNegative() || horizon.isZero()) {
            throw new IllegalArgumentException("horizon must be positive, got: " + horizon);
        }
        this.baseRate = baseRate;
        this.horizon = horizon;
    }

    /**
     * Record one anomaly from {@code source}.
     */
    public synchronized void record(String source, Instant timestamp) {
        Deque<Instant> times = history.computeIfAbsent(source, k -> new ArrayDeque<>());
        times.addLast(timestamp);
        evict(times, timestamp);
    }

    /**
     * @param sources       distinct sources of a cluster
     * @param now           reference time for the trailing horizon
     * @param windowSeconds clustering window
     * @return probability in percent
     */
    public synchronized double probabilityPercent(Collection<String> sources, Instant now, double windowSeconds) {
        double horizonSeconds = horizon.toMillis() / 1000.0;
        Map<String, Double> rates = new HashMap<>();
        for (String source : sources) {
            Deque<Instant> times = history.get(source);
            if (times != null) {
                evict(times, now);
            }
            int count = times == null ? 0 : times.size();
            rates.put(source, count == 0 ? baseRate : count * windowSeconds / horizonSeconds);
        }
        return independentProduct(rates.values());
    }

    /**
     * @param rates per-source rates; each is clamped into [0, 1]
     * @return product of the rates, in percent; 100 for no rates
     */
    public static double independentProduct(Collection<Double> rates) {
        double product = 1.0;
        for (double r : rates) {
            product *= Math.max(0.0, Math.min(1.0, r));
        }
        return product * 100.0;
    }

    public synchronized void clear() {
        history.clear();
    }

    private void evict(Deque<Instant> times, Instant now) {
        Instant cutoff = now.minus(horizon);
        while (!times.isEmpty() && times.peekFirst().isBefore(cutoff)) {
            times.pollFirst();
        }
    }
}
