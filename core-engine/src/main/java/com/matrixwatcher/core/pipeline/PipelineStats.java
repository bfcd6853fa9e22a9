package com.matrixwatcher.core.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters maintained by {@link ObservationPipeline}.
 *
 * <ul>
 *   <li>{@code readings_processed}</li>
 *   <li>{@code anomalies_detected}</li>
 *   <li>{@code conditions_recorded}</li>
 *   <li>{@code events_detected}</li>
 *   <li>{@code stage_failures}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PipelineStats {

    private final AtomicLong readingsProcessed = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();
    private final AtomicLong conditionsRecorded = new AtomicLong();
    private final AtomicLong eventsDetected = new AtomicLong();
    private final AtomicLong stageFailures = new AtomicLong();

    void incrementReadings() {
        readingsProcessed.incrementAndGet();
    }

    void addAnomalies(int n) {
        anomaliesDetected.addAndGet(n);
    }

    void incrementConditions() {
        conditionsRecorded.incrementAndGet();
    }

    void addEvents(int n) {
        eventsDetected.addAndGet(n);
    }

    void incrementFailures() {
        stageFailures.incrementAndGet();
    }

    public long getReadingsProcessed() {
        return readingsProcessed.get();
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected.get();
    }

    public long getConditionsRecorded() {
        return conditionsRecorded.get();
    }

    public long getEventsDetected() {
        return eventsDetected.get();
    }

    public long getStageFailures() {
        return stageFailures.get();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("readings_processed", getReadingsProcessed());
        m.put("anomalies_detected", getAnomaliesDetected());
        m.put("conditions_recorded", getConditionsRecorded());
        m.put("events_detected", getEventsDetected());
        m.put("stage_failures", getStageFailures());
        return m;
    }
}
