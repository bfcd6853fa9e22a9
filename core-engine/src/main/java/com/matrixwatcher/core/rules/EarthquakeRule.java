package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;

import java.util.Map;
import java.util.Optional;

/**
 * Fires when the strongest reported quake reaches a magnitude.
 *
 * <p>
 * Any payload carrying {@code max_magnitude} is considered, whatever its
 * source.
 * </p>
 *
 * @since 1.0.0
 */
public class EarthquakeRule extends AbstractEventRule {

    static final String MAGNITUDE_FIELD = "max_magnitude";

    private final double minMagnitude;

    public EarthquakeRule(EventDefinition definition) {
        super(definition);
        this.minMagnitude = definition.getThreshold();
    }

    @Override
    public boolean matches(Map<String, Object> payload, RuleContext context) {
        Optional<Double> magnitude = Payloads.number(payload, MAGNITUDE_FIELD);
        return magnitude.isPresent() && magnitude.get() >= minMagnitude;
    }

    @Override
    public boolean isGeographic() {
        return true;
    }

    public double getMinMagnitude() {
        return minMagnitude;
    }
}
