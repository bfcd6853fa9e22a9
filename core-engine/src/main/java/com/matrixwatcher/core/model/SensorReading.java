package com.matrixwatcher.core.model;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One reading produced by a sensor collector.
 *
 * <p>
 * The wire shape is {@code {timestamp, source, data}} where {@code timestamp}
 * is epoch seconds and {@code data} is an ordered map of numeric, string or
 * nested values. Unknown top-level properties are folded into {@code data} so
 * that flat payloads are accepted as well.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Collectors build a reading
 * on one thread and hand it off; after that it is only read.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SensorReading {

    /** Payload key carrying the source discriminator for rule checks. */
    public static final String SOURCE_KEY = "source";

    private double timestamp;
    private String source;
    private final Map<String, Object> data = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public SensorReading() {
    }

    /**
     * @param source    sensor name; must not be {@code null}
     * @param timestamp reading time
     * @param data      field values, copied
     */
    public SensorReading(String source, Instant timestamp, Map<String, ?> data) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.timestamp = timestamp.toEpochMilli() / 1000.0;
        if (data != null) {
            this.data.putAll(data);
        }
    }

    // ---------------------------------------------------------------
    // Jackson properties
    // ---------------------------------------------------------------

    public double getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(double timestamp) {
        this.timestamp = timestamp;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    /**
     * @return unmodifiable view of the data fields
     */
    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    /**
     * Replace the data fields (used by Jackson for the {@code data} property).
     *
     * @param data new fields; {@code null} clears
     */
    public void setData(Map<String, Object> data) {
        this.data.clear();
        if (data != null) {
            this.data.putAll(data);
        }
    }

    /**
     * Set one data field. Called by Jackson for every unknown top-level
     * property.
     *
     * @param key   field name; must not be {@code null}
     * @param value field value
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        data.put(key, value);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    /**
     * @return reading time as an {@link Instant}
     */
    @JsonIgnore
    public Instant getInstant() {
        return Instant.ofEpochMilli(Math.round(timestamp * 1000.0));
    }

    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(data.get(fieldName));
    }

    /**
     * Retrieve a numeric field, coercing string-encoded numbers.
     *
     * @param fieldName the data key
     * @return the value as a {@code double}, or empty
     */
    public Optional<Double> getNumericField(String fieldName) {
        return Payloads.number(data.get(fieldName));
    }

    public Optional<String> getStringField(String fieldName) {
        Object raw = data.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Flatten every numeric data field into a {@code name -> value} map.
     *
     * <p>
     * Nested maps contribute {@code parent.child} names. Lists, strings and
     * booleans are skipped, as is any field called {@code timestamp}.
     * </p>
     *
     * @return ordered map of numeric fields
     */
    public Map<String, Double> numericFields() {
        Map<String, Double> out = new LinkedHashMap<>();
        flatten("", data, out);
        return out;
    }

    /**
     * Build the map consumed by the event rules: every data field plus the
     * {@value #SOURCE_KEY} discriminator.
     *
     * @return mutable copy
     */
    public Map<String, Object> toRulePayload() {
        Map<String, Object> payload = new LinkedHashMap<>(data);
        if (source != null) {
            payload.put(SOURCE_KEY, source);
        }
        return payload;
    }

    /**
     * @return a {@link EventType#DATA} bus event carrying this reading
     */
    public Event toEvent() {
        return Event.builder()
                .source(source != null ? source : "unknown")
                .eventType(EventType.DATA)
                .timestamp(getInstant())
                .payload(data)
                .build();
    }

    private static void flatten(String prefix, Map<?, ?> map, Map<String, Double> out) {
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            if ("timestamp".equals(key)) {
                continue;
            }
            String name = prefix.isEmpty() ? key : prefix + "." + key;
            Object value = e.getValue();
            if (value instanceof Map<?, ?> nested) {
                flatten(name, nested, out);
            } else if (value instanceof Number n) {
                out.put(name, n.doubleValue());
            }
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SensorReading that))
            return false;
        return Double.compare(timestamp, that.timestamp) == 0
                && Objects.equals(source, that.source)
                && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, source, data);
    }

    @Override
    public String toString() {
        return "SensorReading{source='" + source + "', timestamp=" + timestamp + ", data=" + data + '}';
    }
}
