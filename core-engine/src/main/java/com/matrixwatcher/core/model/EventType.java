package com.matrixwatcher.core.model;

/**
 * Kind of message carried on the event bus.
 *
 * @since 1.0.0
 */
public enum EventType {

    /** A raw sensor reading. */
    DATA("data"),
    /** A single flagged deviation. */
    ANOMALY("anomaly"),
    /** A group of temporally-close anomalies. */
    CLUSTER("cluster"),
    /** A component failure. */
    ERROR("error"),
    /** Health-monitor notification. */
    HEALTH("health"),
    /** A detected external event worth notifying about. */
    ALERT("alert");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
