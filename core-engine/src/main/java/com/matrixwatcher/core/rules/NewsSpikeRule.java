package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;

import java.util.Map;

/**
 * Fires when the number of new news items reaches a multiple of the typical
 * volume.
 *
 * @since 1.0.0
 */
public class NewsSpikeRule extends AbstractEventRule {

    /** Typical new items per poll. */
    static final double BASELINE_ITEMS = 25.0;

    private final double multiplier;

    public NewsSpikeRule(EventDefinition definition) {
        super(definition);
        this.multiplier = definition.getThreshold();
    }

    @Override
    public boolean matches(Map<String, Object> payload, RuleContext context) {
        return fromSource(payload, "news")
                && Payloads.number(payload, "new_items_count").orElse(0.0) >= BASELINE_ITEMS * multiplier;
    }
}
