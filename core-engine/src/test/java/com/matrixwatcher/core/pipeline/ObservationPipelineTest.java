package com.matrixwatcher.core.pipeline;

import com.matrixwatcher.core.MutableClock;
import com.matrixwatcher.core.bus.EventBus;
import com.matrixwatcher.core.cluster.ClusterDetector;
import com.matrixwatcher.core.cluster.CoOccurrenceEstimator;
import com.matrixwatcher.core.cluster.LevelPolicy;
import com.matrixwatcher.core.detection.AnomalyDetector;
import com.matrixwatcher.core.model.AnomalyRecord;
import com.matrixwatcher.core.model.Event;
import com.matrixwatcher.core.model.EventType;
import com.matrixwatcher.core.model.SensorReading;
import com.matrixwatcher.core.model.Severity;
import com.matrixwatcher.core.pattern.Condition;
import com.matrixwatcher.core.pattern.HistoricalPatternTracker;
import com.matrixwatcher.core.pattern.TrackerSettings;
import com.matrixwatcher.core.rules.EventRuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ObservationPipeline}.
 */
class ObservationPipelineTest {

    private static final Instant T0 = Instant.parse("2024-03-04T08:00:00Z");

    private MutableClock clock;
    private EventBus bus;
    private HistoricalPatternTracker tracker;
    private List<Event> published;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        bus = new EventBus();
        tracker = new HistoricalPatternTracker(EventRuleRegistry.defaults(), TrackerSettings.defaults(), null,
                clock);
        published = new CopyOnWriteArrayList<>();
        bus.subscribe(published::add);
    }

    @Test
    @DisplayName("Should publish every reading as a data event")
    void shouldPublishData() {
        ObservationPipeline pipeline = pipeline(1);

        ObservationResult result = pipeline.process(reading("crypto", "value", 10, 0));

        assertThat(result.isQuiet()).isTrue();
        assertThat(published).extracting(Event::getEventType).containsExactly(EventType.DATA);
        assertThat(pipeline.getStats().getReadingsProcessed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should turn a two-source cluster into a recorded condition")
    void shouldRecordConditionFromCluster() {
        ObservationPipeline pipeline = pipeline(1);
        warmUp(pipeline);

        ObservationResult first = pipeline.process(reading("crypto", "value", 100, 10));
        clock.set(T0.plusSeconds(12));
        ObservationResult second = pipeline.process(reading("earthquake", "count", 50, 12));

        assertThat(first.getAnomalies()).hasSize(1);
        assertThat(first.getCondition()).isEmpty();
        Condition condition = second.getCondition().orElseThrow();
        assertThat(condition.toKey()).isEqualTo("L2_crypto_earthquake");
        assertThat(condition.getTimestamp()).isEqualTo(T0.plusSeconds(12));
        assertThat(condition.getAnomalyIndex()).isEqualTo(50.0);
        assertThat(tracker.getPattern("L2_crypto_earthquake", "earthquake_strong").orElseThrow()
                .getConditionCount()).isEqualTo(1);

        PipelineStats stats = pipeline.getStats();
        assertThat(stats.getAnomaliesDetected()).isEqualTo(2);
        assertThat(stats.getConditionsRecorded()).isEqualTo(1);
        assertThat(stats.getStageFailures()).isZero();
    }

    @Test
    @DisplayName("Should publish anomalies and the cluster with its index and estimates")
    void shouldPublishAnomaliesAndCluster() {
        ObservationPipeline pipeline = pipeline(1);
        warmUp(pipeline);
        published.clear();

        pipeline.process(reading("crypto", "value", 100, 10));
        pipeline.process(reading("earthquake", "count", 50, 12));

        List<Event> anomalies = ofType(EventType.ANOMALY);
        assertThat(anomalies).extracting(Event::getSource).containsExactly("crypto", "earthquake");
        assertThat(anomalies).extracting(Event::getSeverity).containsOnly(Severity.CRITICAL);

        List<Event> clusters = ofType(EventType.CLUSTER);
        assertThat(clusters).hasSize(1);
        Event cluster = clusters.get(0);
        assertThat(cluster.getSource()).isEqualTo("cluster_detector");
        assertThat(cluster.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(cluster.getPayload())
                .containsEntry("condition_key", "L2_crypto_earthquake")
                .containsEntry("level", 2)
                .containsKeys("anomaly_index", "probabilities", "sources");
        @SuppressWarnings("unchecked")
        Map<String, Object> index = (Map<String, Object>) cluster.getPayload().get("anomaly_index");
        assertThat(index).containsEntry("status", "high");
    }

    @Test
    @DisplayName("Should not record clusters below the minimum condition level")
    void shouldRespectMinimumLevel() {
        ObservationPipeline pipeline = pipeline(3);
        warmUp(pipeline);

        pipeline.process(reading("crypto", "value", 100, 10));
        ObservationResult result = pipeline.process(reading("earthquake", "count", 50, 12));

        assertThat(result.getCondition()).isEmpty();
        assertThat(ofType(EventType.CLUSTER)).isEmpty();
        assertThat(tracker.getPatternGroupCount()).isZero();
    }

    @Test
    @DisplayName("Should publish detected external events as alerts")
    void shouldPublishAlerts() {
        ObservationPipeline pipeline = pipeline(1);

        ObservationResult result = pipeline.process(new SensorReading("earthquake", T0,
                Map.of("max_magnitude", 6.5, "latitude", 36.0, "longitude", 140.0)));

        assertThat(result.getEvents()).extracting(e -> e.getEventType())
                .contains("earthquake_strong", "earthquake_moderate")
                .doesNotContain("earthquake_major");
        List<Event> alerts = ofType(EventType.ALERT);
        assertThat(alerts).hasSameSizeAs(result.getEvents());
        assertThat(alerts).extracting(Event::getSource).containsOnly("pattern_tracker");
        assertThat(pipeline.getStats().getEventsDetected()).isEqualTo(result.getEvents().size());
    }

    @Test
    @DisplayName("Should record the closed cluster when it expires")
    void shouldExpireClusters() {
        ObservationPipeline pipeline = pipeline(1);
        warmUp(pipeline);
        pipeline.process(reading("crypto", "value", 100, 10));
        pipeline.process(reading("earthquake", "count", 50, 12));

        clock.set(T0.plusSeconds(30));
        assertThat(pipeline.expireClusters()).isEmpty();

        clock.set(T0.plusSeconds(60));
        Optional<Condition> expired = pipeline.expireClusters();

        assertThat(expired).isPresent();
        assertThat(expired.get().getLevel()).isEqualTo(2);
        assertThat(pipeline.getStats().getConditionsRecorded()).isEqualTo(2);
        assertThat(pipeline.expireClusters()).isEmpty();
    }

    @Test
    @DisplayName("Should keep running later stages when one stage fails")
    void shouldIsolateStageFailures() {
        AnomalyDetector failing = new AnomalyDetector(10, 2.0) {
            @Override
            public List<AnomalyRecord> processReading(SensorReading reading) {
                throw new IllegalStateException("detector broken");
            }
        };
        ObservationPipeline pipeline = new ObservationPipeline(failing, clusterDetector(), tracker, bus,
                new AnomalyIndexCalculator(), 1, clock);

        ObservationResult result = pipeline.process(new SensorReading("space_weather", T0,
                Map.of("kp_index", 7.5)));

        assertThat(pipeline.getStats().getStageFailures()).isEqualTo(1);
        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getEvents()).extracting(e -> e.getEventType()).contains("solar_storm_strong");
    }

    @Test
    @DisplayName("Should reject an out-of-range minimum level")
    void shouldRejectInvalidLevel() {
        assertThatThrownBy(() -> pipeline(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pipeline(6)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private ObservationPipeline pipeline(int minLevel) {
        return new ObservationPipeline(new AnomalyDetector(10, 2.0), clusterDetector(), tracker, bus,
                new AnomalyIndexCalculator(), minLevel, clock);
    }

    private static ClusterDetector clusterDetector() {
        return new ClusterDetector(30.0, 2, 3, new LevelPolicy(), new CoOccurrenceEstimator());
    }

    /** Five quiet readings per source, alternating between two values. */
    private static void warmUp(ObservationPipeline pipeline) {
        for (int i = 0; i < 5; i++) {
            pipeline.process(reading("crypto", "value", i % 2 == 0 ? 10 : 11, i));
            pipeline.process(reading("earthquake", "count", i % 2 == 0 ? 1 : 2, i));
        }
    }

    private static SensorReading reading(String source, String field, double value, long offsetSeconds) {
        return new SensorReading(source, T0.plusSeconds(offsetSeconds), Map.of(field, value));
    }

    private List<Event> ofType(EventType type) {
        return published.stream().filter(e -> e.getEventType() == type).toList();
    }
}
