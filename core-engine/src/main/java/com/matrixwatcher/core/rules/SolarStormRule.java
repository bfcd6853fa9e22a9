package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;

import java.util.Map;

/**
 * Geomagnetic storm on the Kp scale (5-6 moderate, 7-8 strong, 9 extreme).
 *
 * <p>
 * Rules at Kp 5 or below also fire on solar wind of
 * {@value #STORM_WIND_SPEED} km/s or more.
 * </p>
 *
 * @since 1.0.0
 */
public class SolarStormRule extends AbstractEventRule {

    static final double STORM_WIND_SPEED = 700.0;
    static final double WIND_RULE_MAX_KP = 5.0;

    private final double minKp;

    public SolarStormRule(EventDefinition definition) {
        super(definition);
        this.minKp = definition.getThreshold();
    }

    @Override
    public boolean matches(Map<String, Object> payload, RuleContext context) {
        if (!fromSource(payload, "space_weather")) {
            return false;
        }
        if (Payloads.number(payload, "kp_index").orElse(0.0) >= minKp) {
            return true;
        }
        return minKp <= WIND_RULE_MAX_KP
                && Payloads.number(payload, "solar_wind_speed").orElse(0.0) >= STORM_WIND_SPEED;
    }
}
