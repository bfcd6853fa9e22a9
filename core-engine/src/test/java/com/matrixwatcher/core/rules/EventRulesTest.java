package com.matrixwatcher.core.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the built-in {@link EventRule} implementations.
 */
class EventRulesTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private PriceHistory prices;
    private RuleContext context;

    @BeforeEach
    void setUp() {
        prices = new PriceHistory();
        context = new RuleContext(NOW, prices);
    }

    // ---------------------------------------------------------------
    // Crypto
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should fire a pump when the price rose past the threshold over the horizon")
    void shouldDetectPump() {
        prices.record("BTC", NOW.minus(Duration.ofHours(2)), 100.0);
        EventRule pump = EventRuleFactory.create(cryptoMove("btc_pump_1h", "pump"));
        EventRule dump = EventRuleFactory.create(cryptoMove("btc_dump_1h", "dump"));

        Map<String, Object> payload = cryptoPayload(103.0);

        assertThat(pump.matches(payload, context)).isTrue();
        assertThat(dump.matches(payload, context)).isFalse();
    }

    @Test
    @DisplayName("Should fire a dump when the price fell past the threshold over the horizon")
    void shouldDetectDump() {
        prices.record("BTC", NOW.minus(Duration.ofMinutes(90)), 100.0);
        EventRule dump = EventRuleFactory.create(cryptoMove("btc_dump_1h", "dump"));

        assertThat(dump.matches(cryptoPayload(97.0), context)).isTrue();
        assertThat(dump.matches(cryptoPayload(98.5), context)).isFalse();
    }

    @Test
    @DisplayName("Should not fire a crypto move without a reference price old enough")
    void shouldRequireReferencePrice() {
        EventRule pump = EventRuleFactory.create(cryptoMove("btc_pump_1h", "pump"));

        assertThat(pump.matches(cryptoPayload(200.0), context)).isFalse();

        prices.record("BTC", NOW.minus(Duration.ofMinutes(30)), 100.0);
        assertThat(pump.matches(cryptoPayload(200.0), context)).isFalse();
    }

    @Test
    @DisplayName("Should ignore crypto payloads from other sources or without the asset")
    void shouldIgnoreUnrelatedCryptoPayloads() {
        prices.record("BTC", NOW.minus(Duration.ofHours(2)), 100.0);
        EventRule pump = EventRuleFactory.create(cryptoMove("btc_pump_1h", "pump"));

        Map<String, Object> wrongSource = cryptoPayload(150.0);
        wrongSource.put("source", "news");

        assertThat(pump.matches(wrongSource, context)).isFalse();
        assertThat(pump.matches(Map.of("source", "crypto"), context)).isFalse();
        assertThat(pump.matches(Map.of("source", "crypto", "pairs", "garbage"), context)).isFalse();
    }

    @Test
    @DisplayName("Should read volatility from a flat key or a nested path")
    void shouldDetectVolatility() {
        EventRule rule = EventRuleFactory.create(simple("btc_volatility_high", "volatility", 2.5, "crypto"));

        assertThat(rule.matches(Map.of("source", "crypto",
                "btcusdt.price_change_24h_percent", -3.1), context)).isTrue();
        assertThat(rule.matches(Map.of("source", "crypto",
                "btcusdt", Map.of("price_change_24h_percent", 2.5)), context)).isTrue();
        assertThat(rule.matches(Map.of("source", "crypto",
                "btcusdt", Map.of("price_change_24h_percent", 1.0)), context)).isFalse();
        assertThat(rule.matches(Map.of("source", "crypto"), context)).isFalse();
    }

    // ---------------------------------------------------------------
    // Earthquake and space weather
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should fire an earthquake rule on magnitude from any source")
    void shouldDetectEarthquake() {
        EventRule rule = EventRuleFactory.create(simple("earthquake_strong", "earthquake", 6.0, "earthquake"));

        assertThat(rule.isGeographic()).isTrue();
        assertThat(rule.matches(Map.of("source", "earthquake", "max_magnitude", 6.0), context)).isTrue();
        assertThat(rule.matches(Map.of("source", "other", "max_magnitude", "6.4"), context)).isTrue();
        assertThat(rule.matches(Map.of("source", "earthquake", "max_magnitude", 5.9), context)).isFalse();
        assertThat(rule.matches(Map.of("source", "earthquake"), context)).isFalse();
    }

    @Test
    @DisplayName("Should fire a moderate solar storm on Kp or on fast solar wind")
    void shouldDetectSolarStorm() {
        EventRule moderate = EventRuleFactory.create(simple("solar_storm_moderate", "solar_storm", 5.0,
                "space_weather"));
        EventRule strong = EventRuleFactory.create(simple("solar_storm_strong", "solar_storm", 7.0,
                "space_weather"));

        Map<String, Object> fastWind = Map.of("source", "space_weather", "kp_index", 3, "solar_wind_speed", 720);

        assertThat(moderate.matches(Map.of("source", "space_weather", "kp_index", 5), context)).isTrue();
        assertThat(moderate.matches(fastWind, context)).isTrue();
        assertThat(strong.matches(fastWind, context)).isFalse();
        assertThat(strong.matches(Map.of("source", "space_weather", "kp_index", 7.3), context)).isTrue();
        assertThat(moderate.matches(Map.of("source", "crypto", "kp_index", 9), context)).isFalse();
    }

    @Test
    @DisplayName("Should fire a Kp index rule only on space weather payloads")
    void shouldDetectKpIndex() {
        EventRule rule = EventRuleFactory.create(simple("space_weather_storm", "kp_index", 5.0, "other"));

        assertThat(rule.matches(Map.of("source", "space_weather", "kp_index", 5.0), context)).isTrue();
        assertThat(rule.matches(Map.of("source", "space_weather", "kp_index", 4.7), context)).isFalse();
        assertThat(rule.matches(Map.of("kp_index", 8.0), context)).isFalse();
    }

    // ---------------------------------------------------------------
    // Blockchain, news and randomness
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should fire when any network's block interval is a multiple of the expected one")
    void shouldDetectSlowBlocks() {
        EventRule rule = EventRuleFactory.create(simple("blockchain_anomaly", "blockchain", 2.0, "blockchain"));

        Map<String, Object> slow = Map.of("source", "blockchain", "networks", Map.of(
                "bitcoin", Map.of("block_time_seconds", 1300, "expected_block_time", 600),
                "ethereum", Map.of("block_time_seconds", 12, "expected_block_time", 12)));
        Map<String, Object> normal = Map.of("source", "blockchain", "networks", Map.of(
                "bitcoin", Map.of("block_time_seconds", 700, "expected_block_time", 600),
                "broken", Map.of("block_time_seconds", 50, "expected_block_time", 0),
                "junk", "not a map"));

        assertThat(rule.matches(slow, context)).isTrue();
        assertThat(rule.matches(normal, context)).isFalse();
        assertThat(rule.matches(Map.of("source", "blockchain"), context)).isFalse();
    }

    @Test
    @DisplayName("Should fire a news spike at a multiple of the usual volume")
    void shouldDetectNewsSpike() {
        EventRule rule = EventRuleFactory.create(simple("news_spike", "news_spike", 2.0, "other"));

        assertThat(rule.matches(Map.of("source", "news", "new_items_count", 50), context)).isTrue();
        assertThat(rule.matches(Map.of("source", "news", "new_items_count", 49), context)).isFalse();
    }

    @Test
    @DisplayName("Should fire when the randomness score drops below the threshold")
    void shouldDetectLowRandomness() {
        EventRule rule = EventRuleFactory.create(simple("quantum_anomaly", "randomness", 0.9, "other"));

        assertThat(rule.matches(Map.of("source", "quantum_rng", "randomness_score", 0.85), context)).isTrue();
        assertThat(rule.matches(Map.of("source", "quantum_rng", "randomness_score", 0.9), context)).isFalse();
        assertThat(rule.matches(Map.of("source", "quantum_rng"), context)).isFalse();
    }

    @Test
    @DisplayName("Should tolerate null values and unrelated payloads in every rule")
    void shouldNotThrowOnMalformedPayloads() {
        Map<String, Object> junk = new HashMap<>();
        junk.put("source", null);
        junk.put("max_magnitude", null);
        junk.put("networks", List.of(1, 2));

        for (EventRule rule : EventRuleRegistry.defaults().rules()) {
            assertThat(rule.matches(junk, context)).as(rule.getEventType()).isFalse();
            assertThat(rule.matches(Map.of(), context)).as(rule.getEventType()).isFalse();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Map<String, Object> cryptoPayload(double btcPrice) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("source", "crypto");
        payload.put("pairs", List.of(
                Map.of("symbol", "BTCUSDT", "price", btcPrice),
                Map.of("symbol", "ETHUSDT", "price", 3000.0)));
        return payload;
    }

    private static EventDefinition cryptoMove(String name, String direction) {
        EventDefinition def = simple(name, "crypto_move", 2.0, "crypto");
        def.setAsset("BTC");
        def.setDirection(direction);
        def.setHours(1);
        return def;
    }

    private static EventDefinition simple(String name, String type, double threshold, String category) {
        EventDefinition def = new EventDefinition();
        def.setName(name);
        def.setType(type);
        def.setThreshold(threshold);
        def.setCategory(category);
        return def;
    }
}
