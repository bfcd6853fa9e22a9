package com.matrixwatcher.core.pattern;

import com.matrixwatcher.core.MutableClock;
import com.matrixwatcher.core.model.SensorReading;
import com.matrixwatcher.core.rules.EventCategory;
import com.matrixwatcher.core.rules.EventDefinition;
import com.matrixwatcher.core.rules.EventRuleRegistry;
import com.matrixwatcher.core.rules.RuleSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link HistoricalPatternTracker}.
 */
class HistoricalPatternTrackerTest {

    // Monday morning
    private static final Instant T0 = Instant.parse("2024-03-04T08:00:00Z");
    private static final List<String> SOURCES = List.of("crypto", "earthquake");
    private static final Map<String, Object> STRONG_STORM = Map.of("source", "space_weather", "kp_index", 7.5);

    private MutableClock clock;
    private EventRuleRegistry registry;
    private HistoricalPatternTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = EventRuleRegistry.of(definitions());
        tracker = new HistoricalPatternTracker(registry, TrackerSettings.defaults(), null, clock);
    }

    // ---------------------------------------------------------------
    // Counting
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should count every condition and only events inside the lookback window")
    void shouldCountConditionsAndMatches() {
        recordTenConditionsWithFourRecent();

        clock.set(T0.plus(Duration.ofHours(101)));
        List<PatternEvent> events = tracker.checkEvents(STRONG_STORM);

        assertThat(events).extracting(PatternEvent::getEventType).containsExactly("solar_storm_strong");
        Pattern p = tracker.getPattern(baseKey(), "solar_storm_strong").orElseThrow();
        assertThat(p.getConditionCount()).isEqualTo(10);
        assertThat(p.getEventAfterCount()).isEqualTo(4);
        assertThat(p.getActualProbability()).isCloseTo(0.4, within(1e-12));
        assertThat(tracker.getPattern(baseKey(), "earthquake_strong").orElseThrow().getEventAfterCount()).isZero();
    }

    @Test
    @DisplayName("Should match a condition to an event type only once")
    void shouldNotDoubleCountRepeatedEvents() {
        recordTenConditionsWithFourRecent();
        clock.set(T0.plus(Duration.ofHours(101)));
        tracker.checkEvents(STRONG_STORM);

        clock.advance(Duration.ofMinutes(5));
        tracker.checkEvents(STRONG_STORM);

        assertThat(tracker.getPattern(baseKey(), "solar_storm_strong").orElseThrow().getEventAfterCount())
                .isEqualTo(4);
    }

    @Test
    @DisplayName("Should ignore conditions observed at or after the event")
    void shouldIgnoreSimultaneousConditions() {
        tracker.recordCondition(condition(T0));

        int matched = tracker.matchEvent(storm(T0));

        assertThat(matched).isZero();
        assertThat(tracker.matchEvent(storm(T0.plusSeconds(1)))).isEqualTo(1);
    }

    @Test
    @DisplayName("Should update the base and the temporal pattern together")
    void shouldUpdateTemporalPattern() {
        Condition c = condition(T0);
        tracker.recordCondition(c);
        tracker.matchEvent(storm(T0.plus(Duration.ofHours(2))));

        Pattern temporal = tracker.getPattern(c.toTemporalKey(), "solar_storm_strong").orElseThrow();
        assertThat(c.toTemporalKey()).isEqualTo("L2_crypto_earthquake_morning_weekday");
        assertThat(temporal.getConditionCount()).isEqualTo(1);
        assertThat(temporal.getEventAfterCount()).isEqualTo(1);
        assertThat(temporal.getAvgTimeToEvent()).isEqualTo(7200.0);
        assertThat(tracker.getPatternGroupCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should record crypto prices before rules see the payload")
    void shouldFeedPriceHistory() {
        tracker.checkEvents(cryptoPayload(100.0));
        clock.advance(Duration.ofHours(2));

        List<PatternEvent> events = tracker.checkEvents(cryptoPayload(103.0));

        assertThat(tracker.getPriceHistory().size("BTC")).isEqualTo(2);
        assertThat(events).extracting(PatternEvent::getEventType).containsExactly("btc_pump_1h");
        assertThat(events.get(0).getMetadata()).containsEntry("description", "BTC +2% in 1 hour");
    }

    @Test
    @DisplayName("Should attach the location to geographic events")
    void shouldLocateGeographicEvents() {
        SensorReading quake = new SensorReading("earthquake", T0,
                Map.of("max_magnitude", 6.4, "latitude", 35.6, "longitude", 139.7));

        List<PatternEvent> events = tracker.checkEvents(quake);

        assertThat(events).extracting(PatternEvent::getEventType)
                .containsExactly("earthquake_moderate", "earthquake_strong");
        assertThat(events.get(1).getLocation()).contains(new GeoPoint(35.6, 139.7));
        assertThat(tracker.checkEvents(Map.of())).isEmpty();
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should report the observed rate with lead times in hours")
    void shouldReportProbabilities() {
        recordTenConditionsWithFourRecent();
        clock.set(T0.plus(Duration.ofHours(101)));
        tracker.checkEvents(STRONG_STORM);

        Map<String, ProbabilityEstimate> result = tracker.getProbabilities(condition(clock.instant()));

        assertThat(result).containsOnlyKeys("solar_storm_strong");
        ProbabilityEstimate estimate = result.get("solar_storm_strong");
        assertThat(estimate.getProbability()).isCloseTo(0.4, within(1e-12));
        assertThat(estimate.getObservations()).isEqualTo(10);
        assertThat(estimate.getOccurrences()).isEqualTo(4);
        assertThat(estimate.getMinTimeHours().orElseThrow()).isCloseTo(0.95, within(1e-9));
        assertThat(estimate.getMaxTimeHours().orElseThrow()).isCloseTo(1.0, within(1e-9));
        assertThat(estimate.getSeverity()).isEqualTo("high");
        assertThat(estimate.getCategory()).isEqualTo("space_weather");
        assertThat(estimate.isTemporalPattern()).isFalse();
    }

    @Test
    @DisplayName("Should apply the category filter and the observation minimum")
    void shouldFilterProbabilities() {
        recordTenConditionsWithFourRecent();
        clock.set(T0.plus(Duration.ofHours(101)));
        tracker.checkEvents(STRONG_STORM);
        Condition current = condition(clock.instant());

        assertThat(tracker.getProbabilities(current, 5, EventCategory.EARTHQUAKE)).isEmpty();
        assertThat(tracker.getProbabilities(current, 5, EventCategory.SPACE_WEATHER)).hasSize(1);
        assertThat(tracker.getProbabilities(current, 11, null)).isEmpty();
        assertThat(tracker.getProbabilities(new Condition(T0, 5, List.of("x"), 0, 0))).isEmpty();
    }

    @Test
    @DisplayName("Should prefer the time-bucketed pattern once it has enough observations")
    void shouldPreferTemporalPattern() {
        TrackerSettings settings = TrackerSettings.builder().temporalMinObservations(3).build();
        tracker = new HistoricalPatternTracker(registry, settings, null, clock);
        for (int i = 0; i < 5; i++) {
            tracker.recordCondition(condition(T0.plusSeconds(i)));
        }
        tracker.matchEvent(storm(T0.plus(Duration.ofHours(1))));

        ProbabilityEstimate estimate = tracker.getProbabilities(condition(T0)).get("solar_storm_strong");

        assertThat(estimate.isTemporalPattern()).isTrue();
        assertThat(estimate.getTimeBucket()).contains("morning (06-12 UTC)");
        assertThat(estimate.getWeekend()).contains(false);
        assertThat(estimate.toMap()).containsEntry("temporal_pattern", true);
    }

    @Test
    @DisplayName("Should skip patterns whose events follow too quickly")
    void shouldSkipShortLeadTimes() {
        for (int i = 0; i < 5; i++) {
            tracker.recordCondition(condition(T0.plusSeconds(i)));
        }
        tracker.matchEvent(storm(T0.plus(Duration.ofMinutes(10))));

        assertThat(tracker.getPattern(baseKey(), "solar_storm_strong").orElseThrow().getActualProbability())
                .isEqualTo(1.0);
        assertThat(tracker.getProbabilities(condition(T0))).isEmpty();
    }

    @Test
    @DisplayName("Should skip hidden and internal event types")
    void shouldSkipHiddenAndInternalTypes() {
        for (int i = 0; i < 5; i++) {
            tracker.recordCondition(condition(T0.plusSeconds(i)));
        }
        clock.set(T0.plus(Duration.ofHours(2)));
        tracker.checkEvents(Map.of("source", "earthquake", "max_magnitude", 5.2));
        tracker.checkEvents(Map.of("source", "news", "new_items_count", 80));

        assertThat(tracker.getPattern(baseKey(), "earthquake_moderate").orElseThrow().getEventAfterCount())
                .isEqualTo(5);
        assertThat(tracker.getPattern(baseKey(), "news_spike").orElseThrow().getEventAfterCount()).isEqualTo(5);
        assertThat(tracker.getProbabilities(condition(T0))).isEmpty();
    }

    @Test
    @DisplayName("Should report a tight seismic pattern with its dominant region")
    void shouldReportSeismicRegion() {
        tracker.recordCondition(condition(T0));
        clock.set(T0.plus(Duration.ofHours(1)));
        tracker.checkEvents(japanQuake());
        for (int i = 0; i < 4; i++) {
            tracker.recordCondition(condition(T0.plus(Duration.ofHours(2)).plusSeconds(i)));
        }
        clock.set(T0.plus(Duration.ofHours(3)));
        tracker.checkEvents(japanQuake());

        Map<String, ProbabilityEstimate> result = tracker.getProbabilities(condition(clock.instant()));

        assertThat(result).containsOnlyKeys("earthquake_strong");
        assertThat(result.get("earthquake_strong").getRegion()).contains("Japan");
        assertThat(result.get("earthquake_strong").getProbability()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should drop seismic patterns whose lead times spread too widely")
    void shouldDropWideSeismicWindows() {
        tracker.recordCondition(condition(T0));
        clock.set(T0.plus(Duration.ofHours(1)));
        tracker.checkEvents(japanQuake());
        for (int i = 0; i < 4; i++) {
            tracker.recordCondition(condition(T0.plus(Duration.ofHours(2)).plusSeconds(i)));
        }
        clock.set(T0.plus(Duration.ofHours(20)));
        tracker.checkEvents(japanQuake());

        Pattern p = tracker.getPattern(baseKey(), "earthquake_strong").orElseThrow();
        assertThat(p.getEventAfterCount()).isEqualTo(5);
        assertThat(tracker.getProbabilities(condition(clock.instant()))).isEmpty();
    }

    // ---------------------------------------------------------------
    // Calibration
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should score calibration from surfaced predictions")
    void shouldComputeCalibration() {
        recordTenConditionsWithFourRecent();
        clock.set(T0.plus(Duration.ofHours(101)));
        tracker.checkEvents(STRONG_STORM);

        assertThat(tracker.recordPrediction(baseKey(), "solar_storm_strong", 0.3)).isTrue();
        CalibrationStats stats = tracker.getCalibrationStats();

        assertThat(tracker.getPattern(baseKey(), "solar_storm_strong").orElseThrow().getBrierScore())
                .isCloseTo(0.01, within(1e-12));
        // base and early temporal group qualify, one pattern per event type each
        assertThat(stats.getTotalPatterns()).isEqualTo(2 * registry.size());
        assertThat(stats.getWellCalibratedPercent()).isEqualTo(100.0);
        assertThat(stats.getAvgBrierScore()).isCloseTo(0.01 / (2 * registry.size()), within(1e-12));
    }

    @Test
    @DisplayName("Should count badly calibrated patterns")
    void shouldFlagPoorCalibration() {
        recordTenConditionsWithFourRecent();
        clock.set(T0.plus(Duration.ofHours(101)));
        tracker.checkEvents(STRONG_STORM);
        tracker.recordPrediction(baseKey(), "solar_storm_strong", 0.9);

        CalibrationStats stats = tracker.getCalibrationStats();

        int total = 2 * registry.size();
        assertThat(stats.getWellCalibratedPercent()).isCloseTo((total - 1) * 100.0 / total, within(1e-9));
    }

    @Test
    @DisplayName("Should return empty calibration without qualifying patterns")
    void shouldReturnEmptyCalibration() {
        CalibrationStats stats = tracker.getCalibrationStats();

        assertThat(stats.getTotalPatterns()).isZero();
        assertThat(stats.getAvgBrierScore()).isZero();
    }

    @Test
    @DisplayName("Should validate predictions and ignore unknown patterns")
    void shouldValidatePredictions() {
        assertThatThrownBy(() -> tracker.recordPrediction(baseKey(), "solar_storm_strong", 1.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(tracker.recordPrediction("L9_none", "solar_storm_strong", 0.5)).isFalse();
    }

    // ---------------------------------------------------------------
    // State
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should save and restore patterns and matched conditions")
    void shouldRoundTripThroughRepository() {
        InMemoryRepository repository = new InMemoryRepository();
        tracker = new HistoricalPatternTracker(registry, TrackerSettings.defaults(), repository, clock);
        tracker.init();
        tracker.recordCondition(condition(T0));
        clock.set(T0.plus(Duration.ofHours(1)));
        tracker.checkEvents(STRONG_STORM);

        assertThat(tracker.save()).isTrue();

        HistoricalPatternTracker restored = new HistoricalPatternTracker(registry, TrackerSettings.defaults(),
                repository, clock);
        restored.init();
        Pattern p = restored.getPattern(baseKey(), "solar_storm_strong").orElseThrow();
        assertThat(p.getConditionCount()).isEqualTo(1);
        assertThat(p.getEventAfterCount()).isEqualTo(1);
        assertThat(restored.getRecentConditionCount()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(5));
        restored.checkEvents(STRONG_STORM);
        assertThat(restored.getPattern(baseKey(), "solar_storm_strong").orElseThrow().getEventAfterCount())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop restored conditions older than the lookback")
    void shouldDropExpiredConditionsOnImport() {
        tracker.recordCondition(condition(T0));
        tracker.recordCondition(condition(T0.plus(Duration.ofHours(50))));
        TrackerState state = tracker.exportState();

        clock.set(T0.plus(Duration.ofHours(80)));
        tracker.importState(state);

        assertThat(tracker.getRecentConditionCount()).isEqualTo(1);
        assertThat(tracker.getPattern(baseKey(), "solar_storm_strong").orElseThrow().getConditionCount())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("Should fire a pump rule right after restoring saved prices")
    void shouldRestorePriceHistory() {
        InMemoryRepository repository = new InMemoryRepository();
        tracker = new HistoricalPatternTracker(registry, TrackerSettings.defaults(), repository, clock);
        tracker.checkEvents(cryptoPayload(100.0));
        tracker.save();

        clock.advance(Duration.ofHours(2));
        HistoricalPatternTracker restored = new HistoricalPatternTracker(registry, TrackerSettings.defaults(),
                repository, clock);
        restored.init();
        List<PatternEvent> events = restored.checkEvents(cryptoPayload(103.0));

        assertThat(events).extracting(PatternEvent::getEventType).containsExactly("btc_pump_1h");
    }

    @Test
    @DisplayName("Should drop saved prices older than the lookback")
    void shouldDropExpiredPricesOnImport() {
        tracker.checkEvents(cryptoPayload(100.0));
        clock.set(T0.plus(Duration.ofHours(50)));
        tracker.checkEvents(cryptoPayload(101.0));
        TrackerState state = tracker.exportState();

        clock.set(T0.plus(Duration.ofHours(80)));
        tracker.importState(state);

        assertThat(state.getPriceHistory().get("BTC")).hasSize(2);
        assertThat(tracker.getPriceHistory().size("BTC")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip malformed entries when importing")
    void shouldSkipMalformedEntries() {
        Map<String, Object> goodCondition = condition(T0).toMap();
        TrackerState state = new TrackerState(
                Map.of(baseKey(), Map.of("solar_storm_strong", Map.of("condition_count", 3))),
                List.of(Map.of("level", 2), goodCondition));

        tracker.importState(state);

        assertThat(tracker.getRecentConditionCount()).isEqualTo(1);
        assertThat(tracker.getPattern(baseKey(), "solar_storm_strong").orElseThrow().getConditionCount())
                .isEqualTo(3);
    }

    @Test
    @DisplayName("Should start empty when stored state cannot be read")
    void shouldStartEmptyOnCorruptStore() {
        InMemoryRepository repository = new InMemoryRepository();
        repository.failing = true;
        tracker = new HistoricalPatternTracker(registry, TrackerSettings.defaults(), repository, clock);
        tracker.recordCondition(condition(T0));

        tracker.init();

        assertThat(tracker.getPatternGroupCount()).isZero();
        assertThat(tracker.getRecentConditionCount()).isZero();
        assertThat(tracker.save()).isFalse();
    }

    @Test
    @DisplayName("Should work without storage")
    void shouldRunWithoutRepository() {
        tracker.init();

        assertThat(tracker.save()).isFalse();
        tracker.shutdown();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Six conditions at T0 and four around T0+100h. */
    private void recordTenConditionsWithFourRecent() {
        for (int i = 0; i < 6; i++) {
            tracker.recordCondition(condition(T0.plusSeconds(i)));
        }
        for (int i = 0; i < 4; i++) {
            tracker.recordCondition(condition(T0.plus(Duration.ofHours(100)).plus(Duration.ofMinutes(i))));
        }
    }

    private static Condition condition(Instant timestamp) {
        return new Condition(timestamp, 2, SOURCES, 30.0, 1.0);
    }

    private static String baseKey() {
        return "L2_crypto_earthquake";
    }

    private static PatternEvent storm(Instant at) {
        return new PatternEvent(at, "solar_storm_strong", RuleSeverity.HIGH,
                EventCategory.SPACE_WEATHER, Map.of(), null);
    }

    private static Map<String, Object> japanQuake() {
        return Map.of("source", "earthquake", "max_magnitude", 6.5, "latitude", 36.0, "longitude", 140.0);
    }

    private static Map<String, Object> cryptoPayload(double btcPrice) {
        return Map.of("source", "crypto", "pairs", List.of(Map.of("symbol", "BTCUSDT", "price", btcPrice)));
    }

    private static List<EventDefinition> definitions() {
        Set<String> chosen = Set.of("btc_pump_1h", "earthquake_moderate", "earthquake_strong",
                "solar_storm_strong", "news_spike");
        return EventRuleRegistry.defaultDefinitions().stream()
                .filter(d -> chosen.contains(d.getName()))
                .toList();
    }

    private static final class InMemoryRepository implements PatternRepository {
        private TrackerState stored = TrackerState.empty();
        private boolean failing;

        @Override
        public TrackerState load() throws IOException {
            if (failing) {
                throw new IOException("corrupt pattern file");
            }
            return stored;
        }

        @Override
        public void save(TrackerState state) throws IOException {
            if (failing) {
                throw new IOException("disk full");
            }
            stored = state;
        }
    }
}
