package com.matrixwatcher.core.pipeline;

import com.matrixwatcher.core.model.AnomalyRecord;
import com.matrixwatcher.core.pattern.Condition;
import com.matrixwatcher.core.pattern.PatternEvent;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * What one reading produced as it passed through {@link ObservationPipeline}.
 *
 * @since 1.0.0
 */
public final class ObservationResult {

    private final List<AnomalyRecord> anomalies;
    private final Condition condition;
    private final List<PatternEvent> events;

    ObservationResult(List<AnomalyRecord> anomalies, Condition condition, List<PatternEvent> events) {
        this.anomalies = Collections.unmodifiableList(anomalies);
        this.condition = condition;
        this.events = Collections.unmodifiableList(events);
    }

    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    /**
     * @return the condition recorded for this reading, if a cluster of
     *         sufficient level was open
     */
    public Optional<Condition> getCondition() {
        return Optional.ofNullable(condition);
    }

    public List<PatternEvent> getEvents() {
        return events;
    }

    public boolean isQuiet() {
        return anomalies.isEmpty() && condition == null && events.isEmpty();
    }
}
