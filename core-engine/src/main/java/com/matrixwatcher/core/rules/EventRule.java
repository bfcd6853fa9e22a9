package com.matrixwatcher.core.rules;

import java.util.Map;

/**
 * Pure predicate that recognises one external event type in a sensor
 * payload.
 *
 * <p>
 * Implementations must not throw for malformed or unrelated payloads; they
 * return {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
public interface EventRule {

    /**
     * @param payload sensor data including the {@code source} discriminator
     * @param context evaluation time and shared price history
     * @return {@code true} if the event occurred
     */
    boolean matches(Map<String, Object> payload, RuleContext context);

    /**
     * @return the event type this rule detects
     */
    String getEventType();

    RuleSeverity getSeverity();

    EventCategory getCategory();

    String getDescription();

    /**
     * @return {@code true} if the event is excluded from probability queries
     */
    boolean isHidden();

    /**
     * @return {@code true} if events of this rule carry a geographic location
     *         and are judged as seismic
     */
    default boolean isGeographic() {
        return false;
    }
}
