package com.matrixwatcher.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable message published on the
 * {@link com.matrixwatcher.core.bus.EventBus}.
 *
 * <p>
 * The payload is an ordered key/value map of plain values (numbers, strings,
 * lists and nested maps) so that any subscriber can consume it without
 * depending on the producer's types.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #create(String, EventType, Map)} for the common case or the
 * {@link Builder} when the timestamp or severity must be set explicitly.
 * {@code source} and {@code eventType} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class Event {

    private final Instant timestamp;
    private final String source;
    private final EventType eventType;
    private final Map<String, Object> payload;
    private final Severity severity;

    private Event(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType must not be null");
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.severity = builder.severity != null ? builder.severity : Severity.INFO;
        this.payload = builder.payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload))
                : Collections.emptyMap();
    }

    /**
     * Create an {@link Severity#INFO} event stamped with the current time.
     *
     * @param source    producer name
     * @param eventType kind of message
     * @param payload   message body, copied
     * @return new event
     */
    public static Event create(String source, EventType eventType, Map<String, Object> payload) {
        return builder().source(source).eventType(eventType).payload(payload).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Event}.
     */
    public static class Builder {
        private Instant timestamp;
        private String source;
        private EventType eventType;
        private Map<String, Object> payload;
        private Severity severity;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder eventType(EventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * @return a new {@link Event}
         * @throws NullPointerException if {@code source} or {@code eventType} is
         *                              missing
         */
        public Event build() {
            return new Event(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSource() {
        return source;
    }

    public EventType getEventType() {
        return eventType;
    }

    /**
     * @return unmodifiable payload map
     */
    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * @param key payload key
     * @return the value, or empty if absent
     */
    public Optional<Object> getPayloadValue(String key) {
        return Optional.ofNullable(payload.get(key));
    }

    public Severity getSeverity() {
        return severity;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && Objects.equals(source, that.source)
                && eventType == that.eventType
                && severity == that.severity
                && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, source, eventType, severity, payload);
    }

    @Override
    public String toString() {
        return "Event{" +
                "timestamp=" + timestamp +
                ", source='" + source + '\'' +
                ", eventType=" + eventType +
                ", severity=" + severity +
                ", payload=" + payload +
                '}';
    }
}
