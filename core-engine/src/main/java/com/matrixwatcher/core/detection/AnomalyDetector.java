package com.matrixwatcher.core.detection;

import com.matrixwatcher.core.model.AnomalyRecord;
import com.matrixwatcher.core.model.SensorReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streaming z-score classifier keyed by {@code source:parameter}.
 *
 * <p>
 * Each key owns a {@link SlidingWindow} created on first observation. A value
 * is scored against the window <em>before</em> it is inserted and flagged when
 * {@code |z| > threshold}; it is inserted either way so the baseline keeps
 * adapting.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * Fewer than two samples or a zero deviation yield no z-score and therefore
 * no anomaly. Non-finite values are ignored entirely.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Windows live in a {@link ConcurrentHashMap}; each window is locked for the
 * score-then-insert step, so different keys proceed in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final int DEFAULT_WINDOW_SIZE = 100;
    public static final double DEFAULT_THRESHOLD = 4.0;

    private final int windowSize;
    private final double threshold;
    private final Map<String, SlidingWindow> windows = new ConcurrentHashMap<>();

    public AnomalyDetector() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_THRESHOLD);
    }

    /**
     * @param windowSize per-key window capacity; must be &gt;= 2
     * @param threshold  absolute z-score above which a value is anomalous;
     *                   must be &gt; 0
     * @throws IllegalArgumentException if either argument is out of range
     */
    public AnomalyDetector(int windowSize, double threshold) {
        if (windowSize < SlidingWindow.MIN_SAMPLES) {
            throw new IllegalArgumentException("windowSize must be >= "
                    + SlidingWindow.MIN_SAMPLES + ", got: " + windowSize);
        }
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.windowSize = windowSize;
        this.threshold = threshold;
    }

    /**
     * Key under which a window is stored.
     */
    public static String windowKey(String source, String parameter) {
        return source + ":" + parameter;
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Score and record one value stamped with the current time.
     *
     * @see #process(String, String, double, Instant)
     */
    public Optional<AnomalyRecord> process(String source, String parameter, double value) {
        return process(source, parameter, value, Instant.now());
    }

    /**
     * Score {@code value} against the current window, then insert it.
     *
     * @param source    sensor name; must not be {@code null}
     * @param parameter field name; must not be {@code null}
     * @param value     observed value
     * @param timestamp observation time; must not be {@code null}
     * @return a record if {@code |z| > threshold}, empty otherwise
     */
    public Optional<AnomalyRecord> process(String source, String parameter, double value, Instant timestamp) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(parameter, "parameter must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");

        if (!Double.isFinite(value)) {
            LOG.debug("Ignoring non-finite value for {}:{}", source, parameter);
            return Optional.empty();
        }

        SlidingWindow window = windows.computeIfAbsent(windowKey(source, parameter),
                k -> new SlidingWindow(windowSize));

        Optional<AnomalyRecord> result = Optional.empty();
        synchronized (window) {
            OptionalDouble z = window.zScore(value);
            if (z.isPresent() && Math.abs(z.getAsDouble()) > threshold) {
                double mean = window.mean();
                double std = window.std();
                result = Optional.of(new AnomalyRecord(timestamp, source, parameter,
                        value, z.getAsDouble(), mean, std, threshold));
                LOG.debug("Anomaly {}:{} value={} z={} mean={} std={}",
                        source, parameter, value, z.getAsDouble(), mean, std);
            }
            window.add(value);
        }
        return result;
    }

    /**
     * Run every numeric field of a reading through {@link #process}.
     *
     * @param reading sensor reading; must not be {@code null}
     * @return anomalies in field order, possibly empty
     */
    public List<AnomalyRecord> processReading(SensorReading reading) {
        Objects.requireNonNull(reading, "SensorReading must not be null");
        if (reading.getSource() == null) {
            LOG.debug("Reading without source skipped");
            return List.of();
        }
        Instant ts = reading.getInstant();
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Map.Entry<String, Double> field : reading.numericFields().entrySet()) {
            process(reading.getSource(), field.getKey(), field.getValue(), ts).ifPresent(anomalies::add);
        }
        return anomalies;
    }

    // ---------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------

    /**
     * @return count/mean/std of the window, or empty if never observed
     */
    public Optional<WindowStats> getStats(String source, String parameter) {
        SlidingWindow window = windows.get(windowKey(source, parameter));
        if (window == null) {
            return Optional.empty();
        }
        synchronized (window) {
            return Optional.of(new WindowStats(window.size(), window.mean(), window.std()));
        }
    }

    /**
     * @return number of distinct keys observed
     */
    public int getWindowCount() {
        return windows.size();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Drop every window.
     */
    public void clear() {
        windows.clear();
        LOG.debug("Anomaly detector windows cleared");
    }
}
