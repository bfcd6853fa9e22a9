package com.matrixwatcher.core.cluster;

import com.matrixwatcher.core.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Incremental clustering of anomalies as they arrive.
 *
 * <p>
 * Keeps one open component. An arriving anomaly joins it when it lies within
 * {@code windowSeconds} of the component's time range (for a connected 1-D
 * component this is equivalent to having an edge to some member); otherwise
 * the open component is closed and a new one starts. While the open component
 * has at least {@code minClusterSize} members, every admission returns a
 * snapshot {@link Cluster} of it.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All public methods are {@code synchronized}; one detector is shared by every
 * sensor polling task.
 * </p>
 *
 * @since 1.0.0
 */
public class ClusterDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ClusterDetector.class);

    /** Closed clusters retained for diagnostics. */
    static final int RECENT_CLUSTER_CAPACITY = 100;

    private final double windowSeconds;
    private final long windowMillis;
    private final int minClusterSize;
    private final int multiSourceThreshold;
    private final LevelPolicy levelPolicy;
    private final CoOccurrenceEstimator estimator;

    private final List<AnomalyEvent> open = new ArrayList<>();
    private Instant openStart;
    private Instant openEnd;
    private final Deque<Cluster> recent = new ArrayDeque<>();

    public ClusterDetector() {
        this(ClusterAnalyzer.DEFAULT_WINDOW_SECONDS, ClusterAnalyzer.DEFAULT_MIN_CLUSTER_SIZE,
                ClusterAnalyzer.DEFAULT_MULTI_SOURCE_THRESHOLD, new LevelPolicy(), new CoOccurrenceEstimator());
    }

    /**
     * @param windowSeconds        proximity window; must be &gt;= 0
     * @param minClusterSize       members needed before a cluster is reported;
     *                             must be &gt;= 1
     * @param multiSourceThreshold distinct sources for the multi-source flag
     * @param levelPolicy          level assignment
     * @param estimator            co-occurrence estimator fed with every
     *                             admitted anomaly
     */
    public ClusterDetector(double windowSeconds, int minClusterSize, int multiSourceThreshold,
            LevelPolicy levelPolicy, CoOccurrenceEstimator estimator) {
        if (!(windowSeconds >= 0)) {
            throw new IllegalArgumentException("windowSeconds must be >= 0, got: " + windowSeconds);
        }
        if (minClusterSize < 1) {
            throw new IllegalArgumentException("minClusterSize must be >= 1, got: " + minClusterSize);
        }
        if (multiSourceThreshold < 1) {
            throw new IllegalArgumentException(
                    "multiSourceThreshold must be >= 1, got: " + multiSourceThreshold);
        }
        this.windowSeconds = windowSeconds;
        this.windowMillis = Math.round(windowSeconds * 1000.0);
        this.minClusterSize = minClusterSize;
        this.multiSourceThreshold = multiSourceThreshold;
        this.levelPolicy = Objects.requireNonNull(levelPolicy, "LevelPolicy must not be null");
        this.estimator = Objects.requireNonNull(estimator, "CoOccurrenceEstimator must not be null");
    }

    /**
     * Admit one anomaly.
     *
     * @param anomaly the anomaly; must not be {@code null}
     * @return snapshot of the open cluster if it now has enough members
     */
    public synchronized Optional<Cluster> addAnomaly(AnomalyEvent anomaly) {
        Objects.requireNonNull(anomaly, "AnomalyEvent must not be null");
        Instant t = anomaly.getTimestamp();
        estimator.record(anomaly.getSensorSource(), t);

        if (!open.isEmpty() && !withinReach(t)) {
            close();
        }
        open.add(anomaly);
        openStart = openStart == null || t.isBefore(openStart) ? t : openStart;
        openEnd = openEnd == null || t.isAfter(openEnd) ? t : openEnd;

        if (open.size() < minClusterSize) {
            return Optional.empty();
        }
        Cluster cluster = snapshot();
        LOG.debug("Open cluster now {}", cluster);
        return Optional.of(cluster);
    }

    /**
     * Close the open component if nothing arrived for longer than the window.
     *
     * @param now current time
     * @return the closed cluster, if it was large enough
     */
    public synchronized Optional<Cluster> expire(Instant now) {
        if (open.isEmpty() || Duration.between(openEnd, now).toMillis() <= windowMillis) {
            return Optional.empty();
        }
        return close();
    }

    /**
     * @return snapshot of the open component if it is large enough
     */
    public synchronized Optional<Cluster> getCurrentCluster() {
        return open.size() >= minClusterSize ? Optional.of(snapshot()) : Optional.empty();
    }

    /**
     * @return closed clusters, oldest first
     */
    public synchronized List<Cluster> getRecentClusters() {
        return List.copyOf(recent);
    }

    public synchronized int getOpenSize() {
        return open.size();
    }

    public synchronized void clear() {
        open.clear();
        openStart = null;
        openEnd = null;
        recent.clear();
        estimator.clear();
    }

    public double getWindowSeconds() {
        return windowSeconds;
    }

    public int getMinClusterSize() {
        return minClusterSize;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean withinReach(Instant t) {
        long ms = t.toEpochMilli();
        return ms >= openStart.toEpochMilli() - windowMillis && ms <= openEnd.toEpochMilli() + windowMillis;
    }

    private Cluster snapshot() {
        List<String> sources = open.stream().map(AnomalyEvent::getSensorSource).distinct().toList();
        double probability = estimator.probabilityPercent(sources, openEnd, windowSeconds);
        return new Cluster(open, levelPolicy, multiSourceThreshold, probability);
    }

    private Optional<Cluster> close() {
        Optional<Cluster> closed = Optional.empty();
        if (open.size() >= minClusterSize) {
            Cluster cluster = snapshot();
            recent.addLast(cluster);
            if (recent.size() > RECENT_CLUSTER_CAPACITY) {
                recent.pollFirst();
            }
            LOG.info("Cluster closed: level {} with {} anomalies from {}",
                    cluster.getLevel(), cluster.getAnomalyCount(), cluster.getSources());
            closed = Optional.of(cluster);
        }
        open.clear();
        openStart = null;
        openEnd = null;
        return closed;
    }
}
