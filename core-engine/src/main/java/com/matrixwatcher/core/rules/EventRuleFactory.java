package com.matrixwatcher.core.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates {@link EventRule} instances from {@link EventDefinition}s.
 *
 * <p>
 * This is the single point of extension when adding a new rule type.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventRuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EventRuleFactory.class);

    private EventRuleFactory() {
        // utility class
    }

    /**
     * @param definition validated definition; must not be {@code null}
     * @return the matching rule
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static EventRule create(EventDefinition definition) {
        Objects.requireNonNull(definition, "EventDefinition must not be null");
        Objects.requireNonNull(definition.getType(), "Event type must not be null");

        return switch (definition.getType()) {
            case "crypto_move" -> new CryptoMoveRule(definition);
            case "volatility" -> new VolatilityRule(definition);
            case "earthquake" -> new EarthquakeRule(definition);
            case "solar_storm" -> new SolarStormRule(definition);
            case "kp_index" -> new KpIndexRule(definition);
            case "blockchain" -> new BlockchainIntervalRule(definition);
            case "news_spike" -> new NewsSpikeRule(definition);
            case "randomness" -> new RandomnessRule(definition);
            default -> throw new IllegalArgumentException("Unknown event type: '" + definition.getType()
                    + "'. Supported types: crypto_move, volatility, earthquake, solar_storm, kp_index, "
                    + "blockchain, news_spike, randomness");
        };
    }

    /**
     * @return unmodifiable list of rules in definition order
     */
    public static List<EventRule> createAll(List<EventDefinition> definitions) {
        Objects.requireNonNull(definitions, "Definitions list must not be null");
        LOG.info("Creating {} event rule(s)", definitions.size());
        return definitions.stream()
                .map(EventRuleFactory::create)
                .toList();
    }
}
