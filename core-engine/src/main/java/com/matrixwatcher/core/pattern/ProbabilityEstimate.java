package com.matrixwatcher.core.pattern;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Observed frequency of one event type following a condition.
 *
 * <p>
 * Lead times are in hours. {@link #getMinTimeHours()} and
 * {@link #getMaxTimeHours()} are empty until a match has been observed.
 * Temporal fields are set only when the time-bucketed pattern was used;
 * region only for geographic events with a dominant region.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProbabilityEstimate {

    private final double probability;
    private final double avgTimeHours;
    private final Double minTimeHours;
    private final Double maxTimeHours;
    private final long observations;
    private final long occurrences;
    private final String description;
    private final String severity;
    private final String category;
    private final boolean temporalPattern;
    private final String timeBucket;
    private final Boolean weekend;
    private final String region;

    private ProbabilityEstimate(Builder b) {
        this.probability = b.probability;
        this.avgTimeHours = b.avgTimeHours;
        this.minTimeHours = b.minTimeHours;
        this.maxTimeHours = b.maxTimeHours;
        this.observations = b.observations;
        this.occurrences = b.occurrences;
        this.description = b.description;
        this.severity = b.severity;
        this.category = b.category;
        this.temporalPattern = b.temporalPattern;
        this.timeBucket = b.timeBucket;
        this.weekend = b.weekend;
        this.region = b.region;
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private double probability;
        private double avgTimeHours;
        private Double minTimeHours;
        private Double maxTimeHours;
        private long observations;
        private long occurrences;
        private String description;
        private String severity;
        private String category;
        private boolean temporalPattern;
        private String timeBucket;
        private Boolean weekend;
        private String region;

        Builder fromPattern(Pattern p) {
            this.probability = p.getActualProbability();
            this.avgTimeHours = p.getAvgTimeToEvent() / 3600.0;
            this.minTimeHours = Double.isInfinite(p.getMinTimeToEvent()) ? null : p.getMinTimeToEvent() / 3600.0;
            this.maxTimeHours = p.getMaxTimeToEvent() > 0 ? p.getMaxTimeToEvent() / 3600.0 : null;
            this.observations = p.getConditionCount();
            this.occurrences = p.getEventAfterCount();
            return this;
        }

        Builder description(String description) {
            this.description = description;
            return this;
        }

        Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        Builder category(String category) {
            this.category = category;
            return this;
        }

        Builder temporal(TimeBucket bucket, boolean weekend) {
            this.temporalPattern = true;
            this.timeBucket = bucket.label();
            this.weekend = weekend;
            return this;
        }

        Builder region(String region) {
            this.region = region;
            return this;
        }

        ProbabilityEstimate build() {
            return new ProbabilityEstimate(this);
        }
    }

    public double getProbability() {
        return probability;
    }

    public double getAvgTimeHours() {
        return avgTimeHours;
    }

    public Optional<Double> getMinTimeHours() {
        return Optional.ofNullable(minTimeHours);
    }

    public Optional<Double> getMaxTimeHours() {
        return Optional.ofNullable(maxTimeHours);
    }

    public long getObservations() {
        return observations;
    }

    public long getOccurrences() {
        return occurrences;
    }

    public String getDescription() {
        return description;
    }

    public String getSeverity() {
        return severity;
    }

    public String getCategory() {
        return category;
    }

    public boolean isTemporalPattern() {
        return temporalPattern;
    }

    public Optional<String> getTimeBucket() {
        return Optional.ofNullable(timeBucket);
    }

    public Optional<Boolean> getWeekend() {
        return Optional.ofNullable(weekend);
    }

    public Optional<String> getRegion() {
        return Optional.ofNullable(region);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("probability", probability);
        m.put("avg_time_hours", avgTimeHours);
        m.put("min_time_hours", minTimeHours);
        m.put("max_time_hours", maxTimeHours);
        m.put("observations", observations);
        m.put("occurrences", occurrences);
        m.put("description", description);
        m.put("severity", severity);
        m.put("category", category);
        if (temporalPattern) {
            m.put("temporal_pattern", true);
            m.put("time_bucket", timeBucket);
            m.put("is_weekend", weekend);
        }
        if (region != null) {
            m.put("region", region);
        }
        return m;
    }

    @Override
    public String toString() {
        return "ProbabilityEstimate{p=" + probability + ", avgHours=" + avgTimeHours
                + ", observations=" + observations + ", occurrences=" + occurrences + '}';
    }
}
