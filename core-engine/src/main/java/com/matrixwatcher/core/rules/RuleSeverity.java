package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Severity;

import java.util.Locale;
import java.util.Objects;

/**
 * Severity declared by an event definition.
 *
 * @since 1.0.0
 */
public enum RuleSeverity {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    RuleSeverity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @return the bus severity used when this event is published
     */
    public Severity toBusSeverity() {
        return switch (this) {
            case LOW -> Severity.INFO;
            case MEDIUM, HIGH -> Severity.WARNING;
            case CRITICAL -> Severity.CRITICAL;
        };
    }

    /**
     * @throws IllegalArgumentException if the value is unknown
     */
    public static RuleSeverity fromValue(String value) {
        Objects.requireNonNull(value, "Severity value must not be null");
        String normalized = value.toLowerCase(Locale.ROOT);
        for (RuleSeverity s : values()) {
            if (s.value.equals(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown rule severity: '" + value
                + "'. Supported: low, medium, high, critical");
    }
}
