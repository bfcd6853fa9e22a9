package com.matrixwatcher.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single value flagged by the sliding-window detector.
 *
 * <p>
 * Records are emitted, never stored by the detector itself. {@code mean} and
 * {@code std} describe the window <em>before</em> the flagged value was
 * inserted.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRecord {

    /** |z| at or above this multiple of the threshold is reported as critical. */
    static final double CRITICAL_FACTOR = 1.5;

    private final Instant timestamp;
    private final String source;
    private final String parameter;
    private final double value;
    private final double zScore;
    private final double mean;
    private final double std;
    private final double threshold;

    public AnomalyRecord(Instant timestamp, String source, String parameter,
            double value, double zScore, double mean, double std, double threshold) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.parameter = Objects.requireNonNull(parameter, "parameter must not be null");
        this.value = value;
        this.zScore = zScore;
        this.mean = mean;
        this.std = std;
        this.threshold = threshold;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSource() {
        return source;
    }

    public String getParameter() {
        return parameter;
    }

    public double getValue() {
        return value;
    }

    public double getZScore() {
        return zScore;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return {@link Severity#CRITICAL} for extreme deviations, otherwise
     *         {@link Severity#WARNING}
     */
    public Severity severity() {
        return Math.abs(zScore) >= threshold * CRITICAL_FACTOR ? Severity.CRITICAL : Severity.WARNING;
    }

    /**
     * Convert into the event admitted by the cluster detector.
     *
     * @return new {@link AnomalyEvent}
     */
    public AnomalyEvent toAnomalyEvent() {
        return AnomalyEvent.builder()
                .timestamp(timestamp)
                .sensorSource(source)
                .parameter(parameter)
                .value(value)
                .mean(mean)
                .std(std)
                .zScore(zScore)
                .severity(severity())
                .metadata(Map.of("threshold", threshold))
                .build();
    }

    /**
     * @return plain map suitable for a bus payload
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", timestamp.toEpochMilli() / 1000.0);
        m.put("source", source);
        m.put("parameter", parameter);
        m.put("value", value);
        m.put("z_score", zScore);
        m.put("mean", mean);
        m.put("std", std);
        m.put("threshold", threshold);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(zScore, that.zScore) == 0
                && timestamp.equals(that.timestamp)
                && source.equals(that.source)
                && parameter.equals(that.parameter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, source, parameter, value, zScore);
    }

    @Override
    public String toString() {
        return String.format("AnomalyRecord{%s:%s value=%.4f z=%.2f mean=%.4f std=%.4f at %s}",
                source, parameter, value, zScore, mean, std, timestamp);
    }
}
