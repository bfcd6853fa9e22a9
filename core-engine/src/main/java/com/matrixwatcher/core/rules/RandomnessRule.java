package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;

import java.util.Map;
import java.util.Optional;

/**
 * Fires when a random-number source scores below its randomness threshold.
 *
 * @since 1.0.0
 */
public class RandomnessRule extends AbstractEventRule {

    private final double threshold;

    public RandomnessRule(EventDefinition definition) {
        super(definition);
        this.threshold = definition.getThreshold();
    }

    @Override
    public boolean matches(Map<String, Object> payload, RuleContext context) {
        Optional<Double> score = Payloads.number(payload, "randomness_score");
        return score.isPresent() && score.get() < threshold;
    }
}
