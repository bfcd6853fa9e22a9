package com.matrixwatcher.core.rules;

import java.util.Locale;
import java.util.Objects;

/**
 * Grouping of event types for probability queries. {@link #OTHER} is
 * internal-only and never surfaced.
 *
 * @since 1.0.0
 */
public enum EventCategory {

    CRYPTO("crypto"),
    EARTHQUAKE("earthquake"),
    SPACE_WEATHER("space_weather"),
    BLOCKCHAIN("blockchain"),
    OTHER("other");

    private final String value;

    EventCategory(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isInternal() {
        return this == OTHER;
    }

    /**
     * @throws IllegalArgumentException if the value is unknown
     */
    public static EventCategory fromValue(String value) {
        Objects.requireNonNull(value, "Category value must not be null");
        String normalized = value.toLowerCase(Locale.ROOT);
        for (EventCategory c : values()) {
            if (c.value.equals(normalized)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown event category: '" + value
                + "'. Supported: crypto, earthquake, space_weather, blockchain, other");
    }
}
