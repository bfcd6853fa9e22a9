package com.matrixwatcher.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Severity attached to every bus {@link Event}.
 *
 * <p>
 * Constants are declared in ascending order so that
 * {@link #isAtLeast(Severity)} can compare ordinals.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    /**
     * @return lowercase wire value
     */
    public String value() {
        return value;
    }

    /**
     * @param other the minimum severity; must not be {@code null}
     * @return {@code true} if this severity is equal to or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        Objects.requireNonNull(other, "Severity must not be null");
        return ordinal() >= other.ordinal();
    }

    /**
     * Parse a wire value, case-insensitively.
     *
     * @param value the value, e.g. {@code "warning"}
     * @return matching severity
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Severity fromValue(String value) {
        Objects.requireNonNull(value, "Severity value must not be null");
        String normalized = value.toLowerCase(Locale.ROOT);
        for (Severity s : values()) {
            if (s.value.equals(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + value
                + "'. Supported: info, warning, critical");
    }
}
