package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;

import java.util.Map;

/**
 * Fires when the absolute reported 24h change of a crypto field reaches the
 * threshold percentage.
 *
 * @since 1.0.0
 */
public class VolatilityRule extends AbstractEventRule {

    private final String field;
    private final double thresholdPercent;

    public VolatilityRule(EventDefinition definition) {
        super(definition);
        this.field = definition.getField() != null ? definition.getField() : EventDefinition.DEFAULT_VOLATILITY_FIELD;
        this.thresholdPercent = definition.getThreshold();
    }

    @Override
    public boolean matches(Map<String, Object> payload, RuleContext context) {
        if (!fromSource(payload, "crypto")) {
            return false;
        }
        return Math.abs(Payloads.numberAtPath(payload, field).orElse(0.0)) >= thresholdPercent;
    }
}
