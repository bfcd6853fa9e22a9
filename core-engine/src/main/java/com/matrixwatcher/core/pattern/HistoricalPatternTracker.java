package com.matrixwatcher.core.pattern;

import com.matrixwatcher.core.model.Payloads;
import com.matrixwatcher.core.model.SensorReading;
import com.matrixwatcher.core.rules.EventCategory;
import com.matrixwatcher.core.rules.EventRule;
import com.matrixwatcher.core.rules.EventRuleRegistry;
import com.matrixwatcher.core.rules.PriceHistory;
import com.matrixwatcher.core.rules.RuleContext;
import com.matrixwatcher.core.util.RingBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Learns how often each external event follows a cluster condition, and
 * how long it takes.
 *
 * <h3>Counting</h3>
 * <p>
 * {@link #recordCondition(Condition)} buffers the condition and increments
 * the condition count of the base-key and temporal-key pattern for every
 * known event type. When {@link #checkEvents(Map)} detects an event, every
 * buffered condition observed strictly before it and within the lookback
 * window is matched once per event type: a condition already matched to that
 * type is skipped, so a burst of identical events cannot inflate the counts.
 * </p>
 *
 * <h3>Queries</h3>
 * <p>
 * {@link #getProbabilities(Condition, int, EventCategory)} reports only
 * patterns with enough observations, a non-zero rate and a meaningful lead
 * time. The time-bucketed pattern replaces the base one once it has enough
 * observations of its own.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Patterns and the condition buffer are guarded by one read/write lock;
 * queries take the read lock and see a consistent snapshot.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #init()} restores state from the {@link PatternRepository};
 * {@link #save()} and {@link #shutdown()} flush it back. Without a
 * repository the tracker is purely in-memory.
 * </p>
 *
 * @since 1.0.0
 */
public class HistoricalPatternTracker {

    private static final Logger LOG = LoggerFactory.getLogger(HistoricalPatternTracker.class);

    static final String CRYPTO_SOURCE = "crypto";
    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";

    private final EventRuleRegistry registry;
    private final TrackerSettings settings;
    private final PatternRepository repository;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Map<String, Pattern>> patterns = new LinkedHashMap<>();
    private final RingBuffer<TrackedCondition> recentConditions;
    private final PriceHistory priceHistory;

    public HistoricalPatternTracker(EventRuleRegistry registry) {
        this(registry, TrackerSettings.defaults(), null, Clock.systemUTC());
    }

    /**
     * @param registry   event rules; every event type is tracked
     * @param settings   tuning values
     * @param repository storage, or {@code null} for in-memory only
     * @param clock      source of event timestamps
     */
    public HistoricalPatternTracker(EventRuleRegistry registry, TrackerSettings settings,
            PatternRepository repository, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "EventRuleRegistry must not be null");
        this.settings = Objects.requireNonNull(settings, "TrackerSettings must not be null");
        this.repository = repository;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.recentConditions = new RingBuffer<>(settings.getRecentConditionCapacity());
        this.priceHistory = new PriceHistory(settings.getPriceHistoryCapacity());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Restore state from the repository. An unreadable store is logged and
     * the tracker starts empty.
     */
    public void init() {
        if (repository == null) {
            LOG.info("Pattern tracker started without storage");
            return;
        }
        try {
            TrackerState state = repository.load();
            importState(state);
            LOG.info("Pattern tracker restored: {} pattern group(s), {} recent condition(s), {} priced asset(s)",
                    getPatternGroupCount(), getRecentConditionCount(), state.getPriceHistory().size());
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to load pattern state, starting empty: {}", e.getMessage(), e);
            reset();
        }
    }

    /**
     * Write the current state to the repository.
     *
     * @return {@code true} if saved; {@code false} without a repository or
     *         on failure
     */
    public boolean save() {
        if (repository == null) {
            return false;
        }
        try {
            repository.save(exportState());
            LOG.info("Patterns saved: {} pattern group(s)", getPatternGroupCount());
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to save pattern state: {}", e.getMessage(), e);
            return false;
        }
    }

    public void shutdown() {
        save();
        LOG.info("Pattern tracker shut down");
    }

    // ---------------------------------------------------------------
    // Conditions
    // ---------------------------------------------------------------

    public void recordCondition(Condition condition) {
        Objects.requireNonNull(condition, "Condition must not be null");
        String baseKey = condition.toKey();
        String temporalKey = condition.toTemporalKey();

        lock.writeLock().lock();
        try {
            recentConditions.add(new TrackedCondition(condition));
            for (String eventType : registry.eventTypes()) {
                pattern(baseKey, eventType).incrementConditionCount();
                pattern(temporalKey, eventType).incrementConditionCount();
            }
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("Recorded condition {} + {}", baseKey, temporalKey);
    }

    // ---------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------

    public List<PatternEvent> checkEvents(SensorReading reading) {
        Objects.requireNonNull(reading, "SensorReading must not be null");
        return checkEvents(reading.toRulePayload());
    }

    /**
     * Evaluate every rule against one payload and match detected events
     * with buffered conditions.
     *
     * @param payload sensor data including the {@code source} discriminator
     * @return detected events in rule order; never {@code null}
     */
    public List<PatternEvent> checkEvents(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return Collections.emptyList();
        }
        Instant now = clock.instant();
        String source = Payloads.string(payload, SensorReading.SOURCE_KEY).orElse("unknown");
        if (CRYPTO_SOURCE.equals(source)) {
            priceHistory.recordFrom(payload, now, registry.trackedAssets());
        }

        RuleContext context = new RuleContext(now, priceHistory);
        List<PatternEvent> events = new ArrayList<>();
        for (EventRule rule : registry.rules()) {
            boolean fired;
            try {
                fired = rule.matches(payload, context);
            } catch (RuntimeException e) {
                LOG.debug("Rule {} failed on payload from {}: {}", rule.getEventType(), source, e.getMessage());
                continue;
            }
            if (!fired) {
                continue;
            }
            GeoPoint location = rule.isGeographic() ? locationOf(payload) : null;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("description", rule.getDescription());
            PatternEvent event = new PatternEvent(now, rule.getEventType(), rule.getSeverity(),
                    rule.getCategory(), metadata, location);
            events.add(event);
            LOG.info("Event detected: {} from {}", rule.getEventType(), source);
            matchEvent(event);
        }
        return events;
    }

    /**
     * Match one event against the buffered conditions.
     *
     * @return number of conditions newly matched
     */
    public int matchEvent(PatternEvent event) {
        Objects.requireNonNull(event, "PatternEvent must not be null");
        String eventType = event.getEventType();
        double lookbackSeconds = settings.getLookback().getSeconds();
        GeoPoint location = event.getLocation().orElse(null);
        int matched = 0;

        lock.writeLock().lock();
        try {
            for (TrackedCondition tracked : recentConditions) {
                Condition condition = tracked.condition();
                double diff = Duration.between(condition.getTimestamp(), event.getTimestamp()).toMillis() / 1000.0;
                if (diff <= 0 || diff >= lookbackSeconds || tracked.isMatched(eventType)) {
                    continue;
                }
                for (String key : List.of(condition.toKey(), condition.toTemporalKey())) {
                    Map<String, Pattern> byType = patterns.get(key);
                    Pattern p = byType != null ? byType.get(eventType) : null;
                    if (p != null) {
                        p.recordEvent(diff, location, settings.getMaxEventLocations());
                    }
                }
                tracked.markMatched(eventType);
                matched++;
                LOG.debug("Pattern matched: {} ({}) -> {}", condition.toKey(), condition.toTemporalKey(), eventType);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return matched;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public Map<String, ProbabilityEstimate> getProbabilities(Condition condition) {
        return getProbabilities(condition, settings.getMinObservations(), null);
    }

    /**
     * Observed event rates following a condition.
     *
     * @param condition       the current condition
     * @param minObservations conditions required before a rate is reported
     * @param categoryFilter  restrict to one category, or {@code null} for all
     *                        public categories
     * @return event type to estimate, in table order
     */
    public Map<String, ProbabilityEstimate> getProbabilities(Condition condition, int minObservations,
            EventCategory categoryFilter) {
        Objects.requireNonNull(condition, "Condition must not be null");
        Map<String, ProbabilityEstimate> results = new LinkedHashMap<>();

        lock.readLock().lock();
        try {
            Map<String, Pattern> base = patterns.get(condition.toKey());
            if (base == null) {
                return results;
            }
            Map<String, Pattern> temporal = patterns.getOrDefault(condition.toTemporalKey(), Collections.emptyMap());

            for (Map.Entry<String, Pattern> entry : base.entrySet()) {
                String eventType = entry.getKey();
                Optional<EventRule> rule = registry.get(eventType);
                if (rule.isEmpty() || rule.get().isHidden() || rule.get().getCategory().isInternal()) {
                    continue;
                }
                if (categoryFilter != null && rule.get().getCategory() != categoryFilter) {
                    continue;
                }

                Pattern temporalPattern = temporal.get(eventType);
                boolean useTemporal = temporalPattern != null
                        && temporalPattern.getConditionCount() >= settings.getTemporalMinObservations();
                Pattern p = useTemporal ? temporalPattern : entry.getValue();

                if (p.getConditionCount() < minObservations || p.getActualProbability() <= 0) {
                    continue;
                }
                estimate(condition, rule.get(), p, useTemporal).ifPresent(e -> results.put(eventType, e));
            }
        } finally {
            lock.readLock().unlock();
        }
        return results;
    }

    /**
     * Refresh and summarise Brier scores of patterns with enough
     * observations.
     */
    public CalibrationStats getCalibrationStats() {
        int total = 0;
        int wellCalibrated = 0;
        double brierSum = 0.0;

        lock.writeLock().lock();
        try {
            for (Map<String, Pattern> byType : patterns.values()) {
                for (Pattern p : byType.values()) {
                    if (p.getConditionCount() < settings.getCalibrationMinObservations()) {
                        continue;
                    }
                    total++;
                    p.updateBrierScore();
                    brierSum += p.getBrierScore();
                    if (p.getBrierScore() < settings.getWellCalibratedBrier()) {
                        wellCalibrated++;
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return total == 0
                ? new CalibrationStats(0, 0.0, 0.0)
                : new CalibrationStats(total, brierSum / total, wellCalibrated * 100.0 / total);
    }

    /**
     * Remember the probability that was surfaced for a pattern so that its
     * Brier score can be computed.
     *
     * @return {@code false} if the pattern does not exist
     */
    public boolean recordPrediction(String conditionKey, String eventType, double probability) {
        if (probability < 0 || probability > 1) {
            throw new IllegalArgumentException("probability must be in [0, 1], got: " + probability);
        }
        lock.writeLock().lock();
        try {
            Map<String, Pattern> byType = patterns.get(conditionKey);
            Pattern p = byType != null ? byType.get(eventType) : null;
            if (p == null) {
                return false;
            }
            p.setPredictedProbability(probability);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return a copy of the pattern, or empty if unknown
     */
    public Optional<Pattern> getPattern(String conditionKey, String eventType) {
        lock.readLock().lock();
        try {
            Map<String, Pattern> byType = patterns.get(conditionKey);
            Pattern p = byType != null ? byType.get(eventType) : null;
            return Optional.ofNullable(p).map(Pattern::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getPatternGroupCount() {
        lock.readLock().lock();
        try {
            return patterns.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getRecentConditionCount() {
        lock.readLock().lock();
        try {
            return recentConditions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public PriceHistory getPriceHistory() {
        return priceHistory;
    }

    public EventRuleRegistry getRegistry() {
        return registry;
    }

    public TrackerSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // State transfer
    // ---------------------------------------------------------------

    public TrackerState exportState() {
        Map<String, List<Map<String, Object>>> prices =
                priceHistory.exportSince(clock.instant().minus(settings.getLookback()));
        lock.readLock().lock();
        try {
            Map<String, Map<String, Map<String, Object>>> patternData = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, Pattern>> group : patterns.entrySet()) {
                Map<String, Map<String, Object>> byType = new LinkedHashMap<>();
                group.getValue().forEach((type, p) -> byType.put(type, p.toMap()));
                patternData.put(group.getKey(), byType);
            }
            List<Map<String, Object>> conditionData = new ArrayList<>(recentConditions.size());
            for (TrackedCondition tracked : recentConditions) {
                Map<String, Object> m = tracked.condition().toMap();
                m.put(TrackerState.MATCHED_EVENTS, new ArrayList<>(tracked.matchedEvents()));
                conditionData.add(m);
            }
            return new TrackerState(patternData, conditionData, prices);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the current state. Conditions and price samples older than the
     * lookback window are dropped; malformed entries are skipped.
     */
    public void importState(TrackerState state) {
        Objects.requireNonNull(state, "TrackerState must not be null");
        Instant cutoff = clock.instant().minus(settings.getLookback());

        lock.writeLock().lock();
        try {
            patterns.clear();
            recentConditions.clear();
            for (Map.Entry<String, Map<String, Map<String, Object>>> group : state.getPatterns().entrySet()) {
                for (Map.Entry<String, Map<String, Object>> e : group.getValue().entrySet()) {
                    try {
                        patterns.computeIfAbsent(group.getKey(), k -> new LinkedHashMap<>())
                                .put(e.getKey(), Pattern.fromMap(group.getKey(), e.getKey(), e.getValue()));
                    } catch (RuntimeException ex) {
                        LOG.warn("Skipping malformed pattern {} -> {}: {}", group.getKey(), e.getKey(), ex.getMessage());
                    }
                }
            }
            for (Map<String, Object> m : state.getRecentConditions()) {
                try {
                    Condition c = Condition.fromMap(m);
                    if (!c.getTimestamp().isAfter(cutoff)) {
                        continue;
                    }
                    List<String> matched = new ArrayList<>();
                    for (Object type : Payloads.list(m, TrackerState.MATCHED_EVENTS)) {
                        matched.add(String.valueOf(type));
                    }
                    recentConditions.add(new TrackedCondition(c, matched));
                } catch (RuntimeException ex) {
                    LOG.warn("Skipping malformed condition: {}", ex.getMessage());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        priceHistory.clear();
        priceHistory.restore(state.getPriceHistory(), cutoff);
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            patterns.clear();
            recentConditions.clear();
        } finally {
            lock.writeLock().unlock();
        }
        priceHistory.clear();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Pattern pattern(String key, String eventType) {
        return patterns.computeIfAbsent(key, k -> new LinkedHashMap<>())
                .computeIfAbsent(eventType, t -> new Pattern(key, t));
    }

    private Optional<ProbabilityEstimate> estimate(Condition condition, EventRule rule, Pattern p,
            boolean temporal) {
        double avgHours = p.getAvgTimeToEvent() / 3600.0;
        if (avgHours < settings.getMinLeadTimeHours()) {
            return Optional.empty();
        }
        boolean geographic = rule.isGeographic();
        if (geographic && !Double.isInfinite(p.getMinTimeToEvent()) && p.getMaxTimeToEvent() > 0) {
            double windowHours = (p.getMaxTimeToEvent() - p.getMinTimeToEvent()) / 3600.0;
            if (windowHours >= settings.getEarthquakeMaxWindowHours()) {
                return Optional.empty();
            }
        }

        ProbabilityEstimate.Builder b = ProbabilityEstimate.builder()
                .fromPattern(p)
                .description(rule.getDescription())
                .severity(rule.getSeverity().value())
                .category(rule.getCategory().value());
        if (temporal) {
            b.temporal(condition.getTimeBucket(), condition.isWeekend());
        }
        if (geographic) {
            GeoRegions.dominantRegion(p.getEventLocations()).ifPresent(b::region);
        }
        return Optional.of(b.build());
    }

    private static GeoPoint locationOf(Map<String, Object> payload) {
        Optional<Double> lat = Payloads.number(payload, LATITUDE);
        Optional<Double> lon = Payloads.number(payload, LONGITUDE);
        return lat.isPresent() && lon.isPresent() ? new GeoPoint(lat.get(), lon.get()) : null;
    }
}
