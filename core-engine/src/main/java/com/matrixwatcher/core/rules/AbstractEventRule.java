package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;
import com.matrixwatcher.core.model.SensorReading;

import java.util.Map;
import java.util.Objects;

/**
 * Holds the metadata every rule declares.
 *
 * @since 1.0.0
 */
public abstract class AbstractEventRule implements EventRule {

    private final String eventType;
    private final RuleSeverity severity;
    private final EventCategory category;
    private final String description;
    private final boolean hidden;

    protected AbstractEventRule(EventDefinition definition) {
        Objects.requireNonNull(definition, "EventDefinition must not be null");
        this.eventType = Objects.requireNonNull(definition.getName(), "Event name must not be null");
        this.severity = RuleSeverity.fromValue(definition.getSeverity());
        this.category = EventCategory.fromValue(definition.getCategory());
        this.description = definition.getDescription();
        this.hidden = definition.isHidden();
    }

    /**
     * @return {@code true} if the payload's source discriminator equals
     *         {@code expected}
     */
    protected static boolean fromSource(Map<String, Object> payload, String expected) {
        return Payloads.string(payload, SensorReading.SOURCE_KEY).map(expected::equals).orElse(false);
    }

    @Override
    public String getEventType() {
        return eventType;
    }

    @Override
    public RuleSeverity getSeverity() {
        return severity;
    }

    @Override
    public EventCategory getCategory() {
        return category;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean isHidden() {
        return hidden;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + eventType + ", " + severity.value()
                + ", " + category.value() + '}';
    }
}
