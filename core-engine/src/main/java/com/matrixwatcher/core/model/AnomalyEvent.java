package com.matrixwatcher.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A cross-sensor anomaly admitted to clustering.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code timestamp}, {@code sensorSource} and
 * {@code parameter} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEvent {

    private final Instant timestamp;
    private final String sensorSource;
    private final String parameter;
    private final double value;
    private final double mean;
    private final double std;
    private final double zScore;
    private final Severity severity;
    private final Map<String, Object> metadata;

    private AnomalyEvent(Builder b) {
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.sensorSource = Objects.requireNonNull(b.sensorSource, "sensorSource must not be null");
        this.parameter = Objects.requireNonNull(b.parameter, "parameter must not be null");
        this.value = b.value;
        this.mean = b.mean;
        this.std = b.std;
        this.zScore = b.zScore;
        this.severity = b.severity != null ? b.severity : Severity.WARNING;
        this.metadata = b.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyEvent}.
     */
    public static class Builder {
        private Instant timestamp;
        private String sensorSource;
        private String parameter;
        private double value;
        private double mean;
        private double std;
        private double zScore;
        private Severity severity;
        private Map<String, Object> metadata;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sensorSource(String sensorSource) {
            this.sensorSource = sensorSource;
            return this;
        }

        public Builder parameter(String parameter) {
            this.parameter = parameter;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder std(double std) {
            this.std = std;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public AnomalyEvent build() {
            return new AnomalyEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSensorSource() {
        return sensorSource;
    }

    public String getParameter() {
        return parameter;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return the expected value, i.e. the window mean
     */
    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getZScore() {
        return zScore;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return timestamp as fractional epoch seconds
     */
    public double epochSeconds() {
        return timestamp.toEpochMilli() / 1000.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", epochSeconds());
        m.put("sensor_source", sensorSource);
        m.put("parameter", parameter);
        m.put("value", value);
        m.put("expected_value", mean);
        m.put("std", std);
        m.put("z_score", zScore);
        m.put("severity", severity.value());
        if (!metadata.isEmpty()) {
            m.put("metadata", metadata);
        }
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEvent that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && sensorSource.equals(that.sensorSource)
                && parameter.equals(that.parameter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, sensorSource, parameter, value);
    }

    @Override
    public String toString() {
        return "AnomalyEvent{" + sensorSource + ':' + parameter
                + " z=" + zScore + " at " + timestamp + '}';
    }
}
