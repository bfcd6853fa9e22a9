package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;

import java.util.Map;

/**
 * Plain Kp-index threshold on space-weather payloads.
 *
 * @since 1.0.0
 */
public class KpIndexRule extends AbstractEventRule {

    private final double minKp;

    public KpIndexRule(EventDefinition definition) {
        super(definition);
        this.minKp = definition.getThreshold();
    }

    @Override
    public boolean matches(Map<String, Object> payload, RuleContext context) {
        return fromSource(payload, "space_weather")
                && Payloads.number(payload, "kp_index").orElse(0.0) >= minKp;
    }
}
