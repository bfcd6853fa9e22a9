package com.matrixwatcher.core.cluster;

import com.matrixwatcher.core.model.AnomalyEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A group of temporally-close anomalies.
 *
 * <p>
 * Members are held in timestamp order; {@link #getSources()} lists distinct
 * sources in order of first appearance. The level is fixed at construction.
 * {@link #withRank(int)} returns a ranked copy; rank 0 means unranked.
 * </p>
 *
 * @since 1.0.0
 */
public final class Cluster {

    static final Comparator<AnomalyEvent> BY_TIME = Comparator.comparing(AnomalyEvent::getTimestamp);

    private final List<AnomalyEvent> anomalies;
    private final List<String> sources;
    private final int level;
    private final boolean multiSource;
    private final double coOccurrenceProbability;
    private final int rank;

    Cluster(List<AnomalyEvent> members, LevelPolicy policy, int multiSourceThreshold,
            double coOccurrenceProbability) {
        Objects.requireNonNull(members, "members must not be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one anomaly");
        }
        List<AnomalyEvent> sorted = new ArrayList<>(members);
        sorted.sort(BY_TIME);
        this.anomalies = Collections.unmodifiableList(sorted);

        Set<String> distinct = new LinkedHashSet<>();
        for (AnomalyEvent a : sorted) {
            distinct.add(a.getSensorSource());
        }
        this.sources = List.copyOf(distinct);
        this.level = policy.levelFor(sources.size(), sorted.size());
        this.multiSource = sources.size() >= multiSourceThreshold;
        this.coOccurrenceProbability = coOccurrenceProbability;
        this.rank = 0;
    }

    private Cluster(Cluster other, int rank) {
        this.anomalies = other.anomalies;
        this.sources = other.sources;
        this.level = other.level;
        this.multiSource = other.multiSource;
        this.coOccurrenceProbability = other.coOccurrenceProbability;
        this.rank = rank;
    }

    /**
     * @param rank 1-based position in a ranking
     * @return copy carrying {@code rank}
     */
    public Cluster withRank(int rank) {
        return new Cluster(this, rank);
    }

    // ---------------------------------------------------------------
    // Derived attributes
    // ---------------------------------------------------------------

    public List<AnomalyEvent> getAnomalies() {
        return anomalies;
    }

    public int getAnomalyCount() {
        return anomalies.size();
    }

    public List<String> getSources() {
        return sources;
    }

    public int getUniqueSources() {
        return sources.size();
    }

    public Instant getStartTime() {
        return anomalies.get(0).getTimestamp();
    }

    public Instant getEndTime() {
        return anomalies.get(anomalies.size() - 1).getTimestamp();
    }

    public double getTimeSpanSeconds() {
        return Duration.between(getStartTime(), getEndTime()).toMillis() / 1000.0;
    }

    public int getLevel() {
        return level;
    }

    public boolean isMultiSource() {
        return multiSource;
    }

    /**
     * @return chance, in percent, of seeing these sources together by accident
     */
    public double getCoOccurrenceProbability() {
        return coOccurrenceProbability;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Composite ranking score: source diversity dominates, then size, then
     * tightness.
     */
    public double getScore() {
        return getUniqueSources() * 100.0 + getAnomalyCount() + 1.0 / (1.0 + getTimeSpanSeconds());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        if (rank > 0) {
            m.put("rank", rank);
        }
        m.put("level", level);
        m.put("anomaly_count", getAnomalyCount());
        m.put("unique_sources", getUniqueSources());
        m.put("sources", sources);
        m.put("start_time", getStartTime().toEpochMilli() / 1000.0);
        m.put("end_time", getEndTime().toEpochMilli() / 1000.0);
        m.put("time_span_seconds", getTimeSpanSeconds());
        m.put("is_multi_source", multiSource);
        m.put("co_occurrence_probability", coOccurrenceProbability);
        m.put("score", getScore());
        List<Map<String, Object>> members = new ArrayList<>(anomalies.size());
        for (AnomalyEvent a : anomalies) {
            members.add(a.toMap());
        }
        m.put("anomalies", members);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Cluster that))
            return false;
        return level == that.level && rank == that.rank && anomalies.equals(that.anomalies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalies, level, rank);
    }

    @Override
    public String toString() {
        return "Cluster{level=" + level + ", anomalies=" + getAnomalyCount()
                + ", sources=" + sources + ", span=" + getTimeSpanSeconds() + "s, rank=" + rank + '}';
    }
}
