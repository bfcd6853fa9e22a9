package com.matrixwatcher.core.pipeline;

import com.matrixwatcher.core.bus.EventBus;
import com.matrixwatcher.core.cluster.Cluster;
import com.matrixwatcher.core.cluster.ClusterDetector;
import com.matrixwatcher.core.detection.AnomalyDetector;
import com.matrixwatcher.core.model.AnomalyRecord;
import com.matrixwatcher.core.model.Event;
import com.matrixwatcher.core.model.EventType;
import com.matrixwatcher.core.model.SensorReading;
import com.matrixwatcher.core.model.Severity;
import com.matrixwatcher.core.pattern.Condition;
import com.matrixwatcher.core.pattern.HistoricalPatternTracker;
import com.matrixwatcher.core.pattern.PatternEvent;
import com.matrixwatcher.core.pattern.ProbabilityEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one sensor reading through detection, clustering and pattern
 * tracking, publishing what each stage finds on the {@link EventBus}.
 *
 * <h3>Stages</h3>
 * <ol>
 *   <li>the reading itself is published as {@link EventType#DATA};</li>
 *   <li>every numeric field goes through the {@link AnomalyDetector};
 *       anomalies are published as {@link EventType#ANOMALY} and fed to the
 *       {@link ClusterDetector};</li>
 *   <li>a cluster at or above the minimum level becomes a {@link Condition},
 *       is recorded by the tracker and published as
 *       {@link EventType#CLUSTER} together with current estimates;</li>
 *   <li>event rules run over the payload; detected events are published as
 *       {@link EventType#ALERT}.</li>
 * </ol>
 *
 * <h3>Error Handling</h3>
 * <p>
 * A failing stage is logged and counted; later stages still run.
 * </p>
 *
 * @since 1.0.0
 */
public class ObservationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ObservationPipeline.class);

    static final String CLUSTER_SOURCE = "cluster_detector";
    static final String TRACKER_SOURCE = "pattern_tracker";

    private final AnomalyDetector detector;
    private final ClusterDetector clusterDetector;
    private final HistoricalPatternTracker tracker;
    private final EventBus bus;
    private final AnomalyIndexCalculator indexCalculator;
    private final int minConditionLevel;
    private final Clock clock;
    private final PipelineStats stats = new PipelineStats();

    /**
     * @param minConditionLevel lowest cluster level recorded as a condition;
     *                          must be in [1, 5]
     */
    public ObservationPipeline(AnomalyDetector detector, ClusterDetector clusterDetector,
            HistoricalPatternTracker tracker, EventBus bus, AnomalyIndexCalculator indexCalculator,
            int minConditionLevel, Clock clock) {
        this.detector = Objects.requireNonNull(detector, "AnomalyDetector must not be null");
        this.clusterDetector = Objects.requireNonNull(clusterDetector, "ClusterDetector must not be null");
        this.tracker = Objects.requireNonNull(tracker, "HistoricalPatternTracker must not be null");
        this.bus = Objects.requireNonNull(bus, "EventBus must not be null");
        this.indexCalculator = Objects.requireNonNull(indexCalculator, "AnomalyIndexCalculator must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (minConditionLevel < 1 || minConditionLevel > 5) {
            throw new IllegalArgumentException("minConditionLevel must be in [1, 5], got: " + minConditionLevel);
        }
        this.minConditionLevel = minConditionLevel;
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    public ObservationResult process(SensorReading reading) {
        Objects.requireNonNull(reading, "SensorReading must not be null");
        stats.incrementReadings();

        try {
            bus.publish(reading.toEvent());
        } catch (RuntimeException e) {
            stageFailed("publish", reading, e);
        }

        List<AnomalyRecord> anomalies = Collections.emptyList();
        try {
            anomalies = detector.processReading(reading);
            stats.addAnomalies(anomalies.size());
            for (AnomalyRecord a : anomalies) {
                bus.publish(Event.builder()
                        .source(a.getSource())
                        .eventType(EventType.ANOMALY)
                        .timestamp(a.getTimestamp())
                        .severity(a.severity())
                        .payload(a.toMap())
                        .build());
            }
        } catch (RuntimeException e) {
            stageFailed("detection", reading, e);
        }

        Condition condition = null;
        try {
            Cluster latest = null;
            for (AnomalyRecord a : anomalies) {
                Optional<Cluster> c = clusterDetector.addAnomaly(a.toAnomalyEvent());
                if (c.isPresent()) {
                    latest = c.get();
                }
            }
            if (latest != null) {
                condition = onCluster(latest);
            }
        } catch (RuntimeException e) {
            stageFailed("clustering", reading, e);
        }

        List<PatternEvent> events = Collections.emptyList();
        try {
            events = tracker.checkEvents(reading);
            stats.addEvents(events.size());
            for (PatternEvent pe : events) {
                bus.publish(Event.builder()
                        .source(TRACKER_SOURCE)
                        .eventType(EventType.ALERT)
                        .timestamp(pe.getTimestamp())
                        .severity(pe.getSeverity().toBusSeverity())
                        .payload(pe.toMap())
                        .build());
            }
        } catch (RuntimeException e) {
            stageFailed("event check", reading, e);
        }

        return new ObservationResult(new ArrayList<>(anomalies), condition, new ArrayList<>(events));
    }

    /**
     * Close a quiet open cluster and record it.
     *
     * @return the recorded condition, if any
     */
    public Optional<Condition> expireClusters() {
        try {
            Optional<Cluster> closed = clusterDetector.expire(clock.instant());
            return closed.map(c -> {
                LOG.debug("Cluster expired: {}", c);
                return onCluster(c);
            });
        } catch (RuntimeException e) {
            stats.incrementFailures();
            LOG.error("Cluster expiry failed", e);
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Condition onCluster(Cluster cluster) {
        if (cluster.getLevel() < minConditionLevel) {
            return null;
        }
        Instant now = clock.instant();
        AnomalyIndex index = indexCalculator.calculate(cluster.getAnomalies(), now);
        Condition condition = toCondition(cluster, index, now);
        tracker.recordCondition(condition);
        stats.incrementConditions();

        Map<String, Object> payload = cluster.toMap();
        payload.put("condition_key", condition.toKey());
        payload.put("anomaly_index", index.toMap());
        Map<String, Object> estimates = new LinkedHashMap<>();
        for (Map.Entry<String, ProbabilityEstimate> e : tracker.getProbabilities(condition).entrySet()) {
            estimates.put(e.getKey(), e.getValue().toMap());
        }
        payload.put("probabilities", estimates);

        bus.publish(Event.builder()
                .source(CLUSTER_SOURCE)
                .eventType(EventType.CLUSTER)
                .timestamp(now)
                .severity(severityOf(cluster))
                .payload(payload)
                .build());
        LOG.info("Cluster level {} from {} ({} anomalies), index {}", cluster.getLevel(),
                cluster.getSources(), cluster.getAnomalyCount(), String.format("%.1f", index.getIndex()));
        return condition;
    }

    static Condition toCondition(Cluster cluster, AnomalyIndex index, Instant now) {
        return new Condition(now, cluster.getLevel(), cluster.getSources(), index.getIndex(),
                index.getBaselineRatio());
    }

    static Severity severityOf(Cluster cluster) {
        if (cluster.getLevel() >= 4) {
            return Severity.CRITICAL;
        }
        return cluster.isMultiSource() || cluster.getLevel() >= 2 ? Severity.WARNING : Severity.INFO;
    }

    private void stageFailed(String stage, SensorReading reading, RuntimeException e) {
        stats.incrementFailures();
        LOG.error("Pipeline stage [{}] failed for reading from {} - continuing", stage, reading.getSource(), e);
    }

    public PipelineStats getStats() {
        return stats;
    }

    public int getMinConditionLevel() {
        return minConditionLevel;
    }
}
