package com.matrixwatcher.core.config;

import com.matrixwatcher.core.bus.EventBus;
import com.matrixwatcher.core.cluster.ClusterDetector;
import com.matrixwatcher.core.cluster.CoOccurrenceEstimator;
import com.matrixwatcher.core.cluster.LevelPolicy;
import com.matrixwatcher.core.detection.AnomalyDetector;
import com.matrixwatcher.core.model.Priority;
import com.matrixwatcher.core.pattern.TrackerSettings;
import com.matrixwatcher.core.rules.EventDefinition;
import com.matrixwatcher.core.rules.EventRuleRegistry;
import com.matrixwatcher.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level POJO for the watcher YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * analysis:
 *   windowSize: 100
 *   anomalyThreshold: 4.0
 *   clusterWindowSeconds: 30
 * bus:
 *   maxBufferSize: 1000
 * scheduler:
 *   maxConcurrent: 4
 *   priorityIntervals:
 *     high: 10
 * patterns:
 *   lookbackHours: 72
 * events:
 *   - name: btc_pump_1h
 *     type: crypto_move
 *     asset: BTC
 *     direction: pump
 *     hours: 1
 *     threshold: 2.0
 * </pre>
 *
 * <p>
 * When {@code events} is empty the built-in event table is used. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class WatcherSettings {

    private Analysis analysis = new Analysis();
    private BusSection bus = new BusSection();
    private SchedulerSection scheduler = new SchedulerSection();
    private Patterns patterns = new Patterns();
    private List<EventDefinition> events = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section and event definition.
     *
     * <p>
     * Collects all errors and throws a single exception.
     * </p>
     *
     * @throws IllegalStateException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (analysis.windowSize < 2) {
            errors.add("analysis.windowSize must be >= 2");
        }
        if (analysis.anomalyThreshold <= 0) {
            errors.add("analysis.anomalyThreshold must be > 0");
        }
        if (analysis.clusterWindowSeconds < 0) {
            errors.add("analysis.clusterWindowSeconds must be >= 0");
        }
        if (analysis.minClusterSize < 1) {
            errors.add("analysis.minClusterSize must be >= 1");
        }
        if (analysis.multiSourceThreshold < 1) {
            errors.add("analysis.multiSourceThreshold must be >= 1");
        }
        if (analysis.levelDensityFactor < 1) {
            errors.add("analysis.levelDensityFactor must be >= 1");
        }
        if (analysis.sourceBaseRate <= 0 || analysis.sourceBaseRate > 1) {
            errors.add("analysis.sourceBaseRate must be in (0, 1]");
        }
        if (bus.maxBufferSize < 1) {
            errors.add("bus.maxBufferSize must be >= 1");
        }
        if (scheduler.maxConcurrent < 1) {
            errors.add("scheduler.maxConcurrent must be >= 1");
        }
        if (scheduler.tickMillis < 1) {
            errors.add("scheduler.tickMillis must be >= 1");
        }
        PriorityIntervals pi = scheduler.priorityIntervals;
        if (pi.high <= 0 || pi.medium <= 0 || pi.low <= 0) {
            errors.add("scheduler.priorityIntervals must all be > 0");
        }
        try {
            trackerSettings();
        } catch (IllegalArgumentException e) {
            errors.add("patterns: " + e.getMessage());
        }
        if (patterns.minConditionLevel < LevelPolicy.MIN_LEVEL || patterns.minConditionLevel > LevelPolicy.MAX_LEVEL) {
            errors.add("patterns.minConditionLevel must be in [1, 5]");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < events.size(); i++) {
            EventDefinition def = events.get(i);
            if (def == null) {
                errors.add("Event at index " + i + " is null");
                continue;
            }
            try {
                def.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (def.getName() != null && !names.add(def.getName())) {
                errors.add("Duplicate event name: " + def.getName());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid watcher configuration:\n  - "
                    + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Component factories
    // ---------------------------------------------------------------

    public AnomalyDetector newAnomalyDetector() {
        return new AnomalyDetector(analysis.windowSize, analysis.anomalyThreshold);
    }

    public ClusterDetector newClusterDetector() {
        return new ClusterDetector(analysis.clusterWindowSeconds, analysis.minClusterSize,
                analysis.multiSourceThreshold, new LevelPolicy(analysis.levelDensityFactor),
                new CoOccurrenceEstimator(analysis.sourceBaseRate, CoOccurrenceEstimator.DEFAULT_HORIZON));
    }

    public EventBus newEventBus() {
        return new EventBus(bus.maxBufferSize);
    }

    public Scheduler newScheduler() {
        return new Scheduler(scheduler.maxConcurrent, priorityIntervals(),
                Duration.ofMillis(scheduler.tickMillis));
    }

    public Map<Priority, Duration> priorityIntervals() {
        Map<Priority, Duration> m = new EnumMap<>(Priority.class);
        PriorityIntervals pi = scheduler.priorityIntervals;
        m.put(Priority.HIGH, seconds(pi.high));
        m.put(Priority.MEDIUM, seconds(pi.medium));
        m.put(Priority.LOW, seconds(pi.low));
        return m;
    }

    /**
     * @throws IllegalArgumentException if a pattern value is out of range
     */
    public TrackerSettings trackerSettings() {
        return TrackerSettings.builder()
                .lookbackHours(patterns.lookbackHours)
                .recentConditionCapacity(patterns.recentConditionCapacity)
                .priceHistoryCapacity(patterns.priceHistoryCapacity)
                .minObservations(patterns.minObservations)
                .temporalMinObservations(patterns.temporalMinObservations)
                .minLeadTimeHours(patterns.minLeadTimeHours)
                .earthquakeMaxWindowHours(patterns.earthquakeMaxWindowHours)
                .maxEventLocations(patterns.maxEventLocations)
                .build();
    }

    /**
     * @return registry of the configured events, or of the built-in table when
     *         none are configured
     */
    public EventRuleRegistry newEventRegistry() {
        return events.isEmpty() ? EventRuleRegistry.defaults() : EventRuleRegistry.of(events);
    }

    private static Duration seconds(double s) {
        return Duration.ofMillis(Math.round(s * 1000.0));
    }

    // ---------------------------------------------------------------
    // Getters / setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis != null ? analysis : new Analysis();
    }

    public BusSection getBus() {
        return bus;
    }

    public void setBus(BusSection bus) {
        this.bus = bus != null ? bus : new BusSection();
    }

    public SchedulerSection getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerSection scheduler) {
        this.scheduler = scheduler != null ? scheduler : new SchedulerSection();
    }

    public Patterns getPatterns() {
        return patterns;
    }

    public void setPatterns(Patterns patterns) {
        this.patterns = patterns != null ? patterns : new Patterns();
    }

    /**
     * @return unmodifiable list of configured event definitions
     */
    public List<EventDefinition> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public void setEvents(List<EventDefinition> events) {
        this.events = events != null ? new ArrayList<>(events) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Anomaly detection and clustering. */
    public static class Analysis {
        private int windowSize = AnomalyDetector.DEFAULT_WINDOW_SIZE;
        private double anomalyThreshold = AnomalyDetector.DEFAULT_THRESHOLD;
        private double clusterWindowSeconds = 30.0;
        private int minClusterSize = 2;
        private int multiSourceThreshold = 3;
        private int levelDensityFactor = LevelPolicy.DEFAULT_DENSITY_FACTOR;
        private double sourceBaseRate = CoOccurrenceEstimator.DEFAULT_BASE_RATE;

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public double getAnomalyThreshold() {
            return anomalyThreshold;
        }

        public void setAnomalyThreshold(double anomalyThreshold) {
            this.anomalyThreshold = anomalyThreshold;
        }

        public double getClusterWindowSeconds() {
            return clusterWindowSeconds;
        }

        public void setClusterWindowSeconds(double clusterWindowSeconds) {
            this.clusterWindowSeconds = clusterWindowSeconds;
        }

        public int getMinClusterSize() {
            return minClusterSize;
        }

        public void setMinClusterSize(int minClusterSize) {
            this.minClusterSize = minClusterSize;
        }

        public int getMultiSourceThreshold() {
            return multiSourceThreshold;
        }

        public void setMultiSourceThreshold(int multiSourceThreshold) {
            this.multiSourceThreshold = multiSourceThreshold;
        }

        public int getLevelDensityFactor() {
            return levelDensityFactor;
        }

        public void setLevelDensityFactor(int levelDensityFactor) {
            this.levelDensityFactor = levelDensityFactor;
        }

        public double getSourceBaseRate() {
            return sourceBaseRate;
        }

        public void setSourceBaseRate(double sourceBaseRate) {
            this.sourceBaseRate = sourceBaseRate;
        }
    }

    /** Event bus buffering. */
    public static class BusSection {
        private int maxBufferSize = EventBus.DEFAULT_MAX_BUFFER_SIZE;

        public int getMaxBufferSize() {
            return maxBufferSize;
        }

        public void setMaxBufferSize(int maxBufferSize) {
            this.maxBufferSize = maxBufferSize;
        }
    }

    /** Task scheduling. */
    public static class SchedulerSection {
        private int maxConcurrent = Scheduler.DEFAULT_MAX_CONCURRENT;
        private long tickMillis = Scheduler.DEFAULT_TICK.toMillis();
        private PriorityIntervals priorityIntervals = new PriorityIntervals();

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public long getTickMillis() {
            return tickMillis;
        }

        public void setTickMillis(long tickMillis) {
            this.tickMillis = tickMillis;
        }

        public PriorityIntervals getPriorityIntervals() {
            return priorityIntervals;
        }

        public void setPriorityIntervals(PriorityIntervals priorityIntervals) {
            this.priorityIntervals = priorityIntervals != null ? priorityIntervals : new PriorityIntervals();
        }
    }

    /** Default task interval per priority, in seconds. */
    public static class PriorityIntervals {
        private double high = 10.0;
        private double medium = 60.0;
        private double low = 300.0;

        public double getHigh() {
            return high;
        }

        public void setHigh(double high) {
            this.high = high;
        }

        public double getMedium() {
            return medium;
        }

        public void setMedium(double medium) {
            this.medium = medium;
        }

        public double getLow() {
            return low;
        }

        public void setLow(double low) {
            this.low = low;
        }
    }

    /** Pattern learning. */
    public static class Patterns {
        private int lookbackHours = 72;
        private int recentConditionCapacity = 5_000;
        private int priceHistoryCapacity = 10_000;
        private int minObservations = 5;
        private int temporalMinObservations = 50;
        private double minLeadTimeHours = 0.5;
        private double earthquakeMaxWindowHours = 12.0;
        private int maxEventLocations = 1_000;
        private int minConditionLevel = 1;

        public int getLookbackHours() {
            return lookbackHours;
        }

        public void setLookbackHours(int lookbackHours) {
            this.lookbackHours = lookbackHours;
        }

        public int getRecentConditionCapacity() {
            return recentConditionCapacity;
        }

        public void setRecentConditionCapacity(int recentConditionCapacity) {
            this.recentConditionCapacity = recentConditionCapacity;
        }

        public int getPriceHistoryCapacity() {
            return priceHistoryCapacity;
        }

        public void setPriceHistoryCapacity(int priceHistoryCapacity) {
            this.priceHistoryCapacity = priceHistoryCapacity;
        }

        public int getMinObservations() {
            return minObservations;
        }

        public void setMinObservations(int minObservations) {
            this.minObservations = minObservations;
        }

        public int getTemporalMinObservations() {
            return temporalMinObservations;
        }

        public void setTemporalMinObservations(int temporalMinObservations) {
            this.temporalMinObservations = temporalMinObservations;
        }

        public double getMinLeadTimeHours() {
            return minLeadTimeHours;
        }

        public void setMinLeadTimeHours(double minLeadTimeHours) {
            this.minLeadTimeHours = minLeadTimeHours;
        }

        public double getEarthquakeMaxWindowHours() {
            return earthquakeMaxWindowHours;
        }

        public void setEarthquakeMaxWindowHours(double earthquakeMaxWindowHours) {
            this.earthquakeMaxWindowHours = earthquakeMaxWindowHours;
        }

        public int getMaxEventLocations() {
            return maxEventLocations;
        }

        public void setMaxEventLocations(int maxEventLocations) {
            this.maxEventLocations = maxEventLocations;
        }

        public int getMinConditionLevel() {
            return minConditionLevel;
        }

        public void setMinConditionLevel(int minConditionLevel) {
            this.minConditionLevel = minConditionLevel;
        }
    }
}
