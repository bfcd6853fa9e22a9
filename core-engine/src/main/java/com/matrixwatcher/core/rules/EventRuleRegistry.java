package com.matrixwatcher.core.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered table of event rules keyed by event type.
 *
 * <p>
 * {@link #defaults()} holds the built-in table: BTC/ETH pumps and dumps over
 * 1h, 4h and 24h, BTC volatility, slow blockchains, earthquakes, solar storms,
 * and a set of internal-only events.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventRuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(EventRuleRegistry.class);

    private final Map<String, EventRule> rules;
    private final Set<String> trackedAssets;

    private EventRuleRegistry(List<EventRule> ruleList) {
        Map<String, EventRule> byType = new LinkedHashMap<>();
        Set<String> assets = new LinkedHashSet<>();
        for (EventRule rule : ruleList) {
            if (byType.put(rule.getEventType(), rule) != null) {
                throw new IllegalArgumentException("Duplicate event type: " + rule.getEventType());
            }
            if (rule instanceof CryptoMoveRule crypto) {
                assets.add(crypto.getAsset());
            }
        }
        this.rules = Collections.unmodifiableMap(byType);
        this.trackedAssets = Collections.unmodifiableSet(assets);
    }

    /**
     * @param definitions definitions to validate and turn into rules
     * @return new registry in definition order
     * @throws IllegalStateException    if a definition is invalid
     * @throws IllegalArgumentException if two definitions share a name
     */
    public static EventRuleRegistry of(List<EventDefinition> definitions) {
        Objects.requireNonNull(definitions, "Definitions list must not be null");
        definitions.forEach(EventDefinition::validate);
        EventRuleRegistry registry = new EventRuleRegistry(EventRuleFactory.createAll(definitions));
        LOG.info("Event registry ready: {} event type(s), tracked assets {}",
                registry.size(), registry.trackedAssets);
        return registry;
    }

    public static EventRuleRegistry defaults() {
        return of(defaultDefinitions());
    }

    /**
     * @return a fresh mutable copy of the built-in table
     */
    public static List<EventDefinition> defaultDefinitions() {
        List<EventDefinition> d = new ArrayList<>();

        d.add(cryptoMove("btc_pump_1h", "BTC", "pump", 1, 2.0, "medium", "BTC +2% in 1 hour"));
        d.add(cryptoMove("btc_dump_1h", "BTC", "dump", 1, 2.0, "medium", "BTC -2% in 1 hour"));
        d.add(cryptoMove("btc_pump_4h", "BTC", "pump", 4, 4.0, "high", "BTC +4% in 4 hours"));
        d.add(cryptoMove("btc_dump_4h", "BTC", "dump", 4, 4.0, "high", "BTC -4% in 4 hours"));
        d.add(cryptoMove("btc_pump_24h", "BTC", "pump", 24, 7.0, "high", "BTC +7% in 24 hours"));
        d.add(cryptoMove("btc_dump_24h", "BTC", "dump", 24, 7.0, "high", "BTC -7% in 24 hours"));
        d.add(cryptoMove("eth_pump_1h", "ETH", "pump", 1, 2.5, "medium", "ETH +2.5% in 1 hour"));
        d.add(cryptoMove("eth_dump_1h", "ETH", "dump", 1, 2.5, "medium", "ETH -2.5% in 1 hour"));
        d.add(cryptoMove("eth_pump_4h", "ETH", "pump", 4, 5.0, "high", "ETH +5% in 4 hours"));
        d.add(cryptoMove("eth_dump_4h", "ETH", "dump", 4, 5.0, "high", "ETH -5% in 4 hours"));
        d.add(cryptoMove("eth_pump_24h", "ETH", "pump", 24, 10.0, "high", "ETH +10% in 24 hours"));
        d.add(cryptoMove("eth_dump_24h", "ETH", "dump", 24, 10.0, "high", "ETH -10% in 24 hours"));

        d.add(simple("btc_volatility_high", "volatility", 2.5, "high", "crypto", "BTC 24h change of 2.5% or more"));
        d.add(simple("btc_volatility_medium", "volatility", 1.5, "medium", "crypto", "BTC 24h change of 1.5% or more"));
        d.add(simple("blockchain_anomaly", "blockchain", 2.0, "medium", "blockchain",
                "Block time at least twice the expected interval"));

        EventDefinition moderate = simple("earthquake_moderate", "earthquake", 5.0, "medium", "earthquake",
                "Earthquake M5.0+");
        moderate.setHidden(true);
        d.add(moderate);
        d.add(simple("earthquake_strong", "earthquake", 6.0, "high", "earthquake", "Earthquake M6.0+"));
        d.add(simple("earthquake_major", "earthquake", 7.0, "critical", "earthquake", "Earthquake M7.0+"));

        d.add(simple("solar_storm_moderate", "solar_storm", 5.0, "medium", "space_weather",
                "Geomagnetic storm Kp 5+ or solar wind 700 km/s+"));
        d.add(simple("solar_storm_strong", "solar_storm", 7.0, "high", "space_weather", "Geomagnetic storm Kp 7+"));
        d.add(simple("solar_storm_extreme", "solar_storm", 9.0, "critical", "space_weather",
                "Geomagnetic storm Kp 9"));

        d.add(simple("earthquake_significant", "earthquake", 5.5, "high", "other", "Earthquake M5.5+"));
        d.add(simple("earthquake_moderate_old", "earthquake", 5.0, "medium", "other", "Earthquake M5.0+"));
        d.add(simple("news_spike", "news_spike", 2.0, "medium", "other", "News volume twice the usual"));
        d.add(simple("space_weather_storm", "kp_index", 5.0, "high", "other", "Kp index 5+"));
        d.add(simple("quantum_anomaly", "randomness", 0.90, "medium", "other", "Randomness score below 0.90"));
        return d;
    }

    // ---------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------

    public Optional<EventRule> get(String eventType) {
        return Optional.ofNullable(eventType == null ? null : rules.get(eventType));
    }

    /**
     * @return rules in table order
     */
    public Collection<EventRule> rules() {
        return rules.values();
    }

    /**
     * @return event types in table order
     */
    public Set<String> eventTypes() {
        return rules.keySet();
    }

    /**
     * @return assets referenced by crypto move rules
     */
    public Set<String> trackedAssets() {
        return trackedAssets;
    }

    public int size() {
        return rules.size();
    }

    // ---------------------------------------------------------------
    // Table helpers
    // ---------------------------------------------------------------

    private static EventDefinition cryptoMove(String name, String asset, String direction, int hours,
            double threshold, String severity, String description) {
        EventDefinition def = simple(name, "crypto_move", threshold, severity, "crypto", description);
        def.setAsset(asset);
        def.setDirection(direction);
        def.setHours(hours);
        return def;
    }

    private static EventDefinition simple(String name, String type, double threshold, String severity,
            String category, String description) {
        EventDefinition def = new EventDefinition();
        def.setName(name);
        def.setType(type);
        def.setThreshold(threshold);
        def.setSeverity(severity);
        def.setCategory(category);
        def.setDescription(description);
        return def;
    }
}
