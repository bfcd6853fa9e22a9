package com.matrixwatcher.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Scheduling priority of a repeating task. Lower {@link #rank()} runs first.
 *
 * @since 1.0.0
 */
public enum Priority {

    HIGH("high", 0),
    MEDIUM("medium", 1),
    LOW("low", 2);

    private final String value;
    private final int rank;

    Priority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    /**
     * Parse a configuration value, case-insensitively.
     *
     * @param value e.g. {@code "high"}
     * @return matching priority
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Priority fromValue(String value) {
        Objects.requireNonNull(value, "Priority value must not be null");
        String normalized = value.toLowerCase(Locale.ROOT);
        for (Priority p : values()) {
            if (p.value.equals(normalized)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority: '" + value
                + "'. Supported: high, medium, low");
    }
}
