package com.matrixwatcher.core.pattern;

import com.matrixwatcher.core.rules.EventCategory;
import com.matrixwatcher.core.rules.RuleSeverity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An external occurrence recognised by an event rule.
 *
 * @since 1.0.0
 */
public final class PatternEvent {

    private final Instant timestamp;
    private final String eventType;
    private final RuleSeverity severity;
    private final EventCategory category;
    private final Map<String, Object> metadata;
    private final GeoPoint location;

    public PatternEvent(Instant timestamp, String eventType, RuleSeverity severity, EventCategory category,
            Map<String, Object> metadata, GeoPoint location) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
        this.location = location;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getEventType() {
        return eventType;
    }

    public RuleSeverity getSeverity() {
        return severity;
    }

    public EventCategory getCategory() {
        return category;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Optional<GeoPoint> getLocation() {
        return Optional.ofNullable(location);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", timestamp.toEpochMilli() / 1000.0);
        m.put("event_type", eventType);
        m.put("severity", severity.value());
        m.put("category", category.value());
        m.put("metadata", new LinkedHashMap<>(metadata));
        m.put("location", location != null ? location.toList() : null);
        return m;
    }

    @Override
    public String toString() {
        return "PatternEvent{" + eventType + " at " + timestamp + ", severity=" + severity + '}';
    }
}
