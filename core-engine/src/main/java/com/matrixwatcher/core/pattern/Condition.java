package com.matrixwatcher.core.pattern;

import com.matrixwatcher.core.model.Payloads;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of a cluster used as the left-hand side of a pattern.
 *
 * <p>
 * Hour of day, day of week (0 = Monday), weekend flag and month are derived
 * from the timestamp in UTC. The base key is
 * {@code L<level>_<sorted sources joined by '_'>}; the temporal key appends
 * the time bucket and {@code weekday}/{@code weekend}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Condition {

    private final Instant timestamp;
    private final int level;
    private final List<String> sources;
    private final double anomalyIndex;
    private final double baselineRatio;

    private final int hourOfDay;
    private final int dayOfWeek;
    private final boolean weekend;
    private final int month;

    /**
     * @param timestamp     when the cluster was observed
     * @param level         cluster level, 1-5
     * @param sources       sensors involved, order kept
     * @param anomalyIndex  0-100
     * @param baselineRatio activity relative to the rolling baseline
     */
    public Condition(Instant timestamp, int level, List<String> sources, double anomalyIndex, double baselineRatio) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(sources, "sources must not be null");
        if (level < 1) {
            throw new IllegalArgumentException("level must be >= 1, got: " + level);
        }
        this.level = level;
        this.sources = List.copyOf(sources);
        this.anomalyIndex = anomalyIndex;
        this.baselineRatio = baselineRatio;

        ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
        this.hourOfDay = utc.getHour();
        this.dayOfWeek = utc.getDayOfWeek().getValue() - 1;
        this.weekend = utc.getDayOfWeek() == DayOfWeek.SATURDAY || utc.getDayOfWeek() == DayOfWeek.SUNDAY;
        this.month = utc.getMonthValue();
    }

    // ---------------------------------------------------------------
    // Keys
    // ---------------------------------------------------------------

    public String toKey() {
        List<String> sorted = new ArrayList<>(sources);
        sorted.sort(null);
        return "L" + level + "_" + String.join("_", sorted);
    }

    public String toTemporalKey() {
        return toKey() + "_" + getTimeBucket().key() + "_" + (weekend ? "weekend" : "weekday");
    }

    public TimeBucket getTimeBucket() {
        return TimeBucket.fromHour(hourOfDay);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getLevel() {
        return level;
    }

    public List<String> getSources() {
        return sources;
    }

    public double getAnomalyIndex() {
        return anomalyIndex;
    }

    public double getBaselineRatio() {
        return baselineRatio;
    }

    public int getHourOfDay() {
        return hourOfDay;
    }

    /**
     * @return 0 for Monday through 6 for Sunday
     */
    public int getDayOfWeek() {
        return dayOfWeek;
    }

    public boolean isWeekend() {
        return weekend;
    }

    public int getMonth() {
        return month;
    }

    // ---------------------------------------------------------------
    // Plain-map conversion
    // ---------------------------------------------------------------

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", timestamp.toEpochMilli() / 1000.0);
        m.put("level", level);
        m.put("sources", new ArrayList<>(sources));
        m.put("anomaly_index", anomalyIndex);
        m.put("baseline_ratio", baselineRatio);
        m.put("hour_of_day", hourOfDay);
        m.put("day_of_week", dayOfWeek);
        m.put("is_weekend", weekend);
        m.put("month", month);
        return m;
    }

    /**
     * Rebuild from {@link #toMap()} output. Derived fields are recomputed
     * from the timestamp.
     *
     * @throws IllegalArgumentException if {@code timestamp} or {@code level} is
     *                                  missing
     */
    public static Condition fromMap(Map<String, Object> map) {
        Objects.requireNonNull(map, "map must not be null");
        double ts = Payloads.number(map, "timestamp")
                .orElseThrow(() -> new IllegalArgumentException("Condition map lacks 'timestamp'"));
        int level = Payloads.number(map, "level")
                .orElseThrow(() -> new IllegalArgumentException("Condition map lacks 'level'"))
                .intValue();
        List<String> sources = new ArrayList<>();
        for (Object s : Payloads.list(map, "sources")) {
            sources.add(String.valueOf(s));
        }
        return new Condition(Instant.ofEpochMilli(Math.round(ts * 1000.0)), level, sources,
                Payloads.number(map, "anomaly_index").orElse(0.0),
                Payloads.number(map, "baseline_ratio").orElse(0.0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Condition that))
            return false;
        return level == that.level
                && Double.compare(anomalyIndex, that.anomalyIndex) == 0
                && Double.compare(baselineRatio, that.baselineRatio) == 0
                && timestamp.equals(that.timestamp)
                && sources.equals(that.sources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, level, sources, anomalyIndex, baselineRatio);
    }

    @Override
    public String toString() {
        return "Condition{" + toTemporalKey() + " at " + timestamp + ", index=" + anomalyIndex + '}';
    }
}
