package com.matrixwatcher.core.pipeline;

import com.matrixwatcher.core.model.AnomalyEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scores a group of anomalies and compares the score with recent history.
 *
 * <p>
 * Each source contributes {@code min(25, 5 * max|z|)} points; the index is the
 * sum capped at 100. The baseline ratio divides the index by the mean index
 * of the previous scores inside the baseline window.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #calculate} is {@code synchronized}.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyIndexCalculator {

    public static final Duration DEFAULT_BASELINE_WINDOW = Duration.ofHours(24);

    static final double MAX_INDEX = 100.0;
    static final double MAX_SOURCE_POINTS = 25.0;
    static final double POINTS_PER_SIGMA = 5.0;

    private final Duration baselineWindow;
    private final Deque<Sample> history = new ArrayDeque<>();

    public AnomalyIndexCalculator() {
        this(DEFAULT_BASELINE_WINDOW);
    }

    public AnomalyIndexCalculator(Duration baselineWindow) {
        Objects.requireNonNull(baselineWindow, "baselineWindow must not be null");
        if (baselineWindow.isNegative() || baselineWindow.isZero()) {
            throw new IllegalArgumentException("baselineWindow must be positive, got: " + baselineWindow);
        }
        this.baselineWindow = baselineWindow;
    }

    /**
     * @param anomalies cluster members
     * @param now       scoring time; also the time recorded in the baseline
     */
    public synchronized AnomalyIndex calculate(Collection<AnomalyEvent> anomalies, Instant now) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Map<String, Double> maxZ = new LinkedHashMap<>();
        for (AnomalyEvent a : anomalies) {
            maxZ.merge(a.getSensorSource(), Math.abs(a.getZScore()), Math::max);
        }
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<String, Double> e : maxZ.entrySet()) {
            double points = Math.min(MAX_SOURCE_POINTS, POINTS_PER_SIGMA * e.getValue());
            breakdown.put(e.getKey(), points);
            total += points;
        }
        double index = Math.min(MAX_INDEX, total);

        Instant cutoff = now.minus(baselineWindow);
        while (!history.isEmpty() && history.peekFirst().at.isBefore(cutoff)) {
            history.pollFirst();
        }
        double baseline = history.stream().mapToDouble(s -> s.index).average().orElse(0.0);
        double ratio = baseline > 0 ? index / baseline : 1.0;
        history.addLast(new Sample(now, index));

        return new AnomalyIndex(index, statusOf(index), ratio, breakdown);
    }

    static String statusOf(double index) {
        if (index >= 75) {
            return "critical";
        }
        if (index >= 50) {
            return "high";
        }
        if (index >= 25) {
            return "elevated";
        }
        return "normal";
    }

    public synchronized int getHistorySize() {
        return history.size();
    }

    private static final class Sample {
        private final Instant at;
        private final double index;

        private Sample(Instant at, double index) {
            this.at = at;
            this.index = index;
        }
    }
}
