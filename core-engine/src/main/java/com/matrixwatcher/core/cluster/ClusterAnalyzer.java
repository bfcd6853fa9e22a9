package com.matrixwatcher.core.cluster;

import com.matrixwatcher.core.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Batch clustering of a complete anomaly table.
 *
 * <p>
 * Builds an undirected graph with one node per anomaly and an edge between
 * every pair whose timestamps differ by at most {@code windowSeconds}.
 * Connected components of at least {@code minClusterSize} nodes become
 * clusters.
 * </p>
 *
 * <h3>Ranking</h3>
 * <p>
 * Clusters are ordered by unique sources (desc), anomaly count (desc) and
 * time span (asc), then by start time, and assigned 1-based ranks.
 * </p>
 *
 * @since 1.0.0
 */
public class ClusterAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ClusterAnalyzer.class);

    public static final double DEFAULT_WINDOW_SECONDS = 30.0;
    public static final int DEFAULT_MIN_CLUSTER_SIZE = 2;
    public static final int DEFAULT_MULTI_SOURCE_THRESHOLD = 3;

    static final Comparator<Cluster> RANKING = Comparator
            .comparingInt(Cluster::getUniqueSources).reversed()
            .thenComparing(Comparator.comparingInt(Cluster::getAnomalyCount).reversed())
            .thenComparingDouble(Cluster::getTimeSpanSeconds)
            .thenComparing(Cluster::getStartTime);

    private final double windowSeconds;
    private final int minClusterSize;
    private final int multiSourceThreshold;
    private final LevelPolicy levelPolicy;

    public ClusterAnalyzer() {
        this(DEFAULT_WINDOW_SECONDS, DEFAULT_MIN_CLUSTER_SIZE, DEFAULT_MULTI_SOURCE_THRESHOLD);
    }

    public ClusterAnalyzer(double windowSeconds, int minClusterSize, int multiSourceThreshold) {
        this(windowSeconds, minClusterSize, multiSourceThreshold, new LevelPolicy());
    }

    /**
     * @param windowSeconds        max timestamp difference for an edge; must be
     *                             &gt;= 0
     * @param minClusterSize       smallest reportable component; must be &gt;= 1
     * @param multiSourceThreshold distinct sources for the multi-source flag;
     *                             must be &gt;= 1
     * @param levelPolicy          level assignment
     */
    public ClusterAnalyzer(double windowSeconds, int minClusterSize, int multiSourceThreshold,
            LevelPolicy levelPolicy) {
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
        this.minClusterSize = minClusterSize;
        this.multiSourceThreshold = multiSourceThreshold;
        this.levelPolicy = Objects.requireNonNull(levelPolicy, "LevelPolicy must not be null");
    }

    /**
     * Find clusters in chronological order, unranked.
     *
     * @param anomalies input table; must not be {@code null}
     * @return clusters, empty for empty input
     */
    public List<Cluster> findClusters(List<AnomalyEvent> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        if (anomalies.isEmpty()) {
            return List.of();
        }

        List<AnomalyEvent> sorted = new ArrayList<>(anomalies);
        sorted.sort(Cluster.BY_TIME);
        int n = sorted.size();
        long windowMillis = Math.round(windowSeconds * 1000.0);

        UnionFind components = new UnionFind(n);
        int edges = 0;
        for (int i = 0; i < n; i++) {
            long ti = sorted.get(i).getTimestamp().toEpochMilli();
            for (int j = i + 1; j < n; j++) {
                if (sorted.get(j).getTimestamp().toEpochMilli() - ti > windowMillis) {
                    break;
                }
                components.union(i, j);
                edges++;
            }
        }

        Map<Integer, List<AnomalyEvent>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            byRoot.computeIfAbsent(components.find(i), k -> new ArrayList<>()).add(sorted.get(i));
        }

        Map<String, Double> rates = sourceRates(sorted);
        List<Cluster> clusters = new ArrayList<>();
        for (List<AnomalyEvent> members : byRoot.values()) {
            if (members.size() < minClusterSize) {
                continue;
            }
            List<Double> memberRates = new ArrayList<>();
            members.stream().map(AnomalyEvent::getSensorSource).distinct()
                    .forEach(s -> memberRates.add(rates.get(s)));
            clusters.add(new Cluster(members, levelPolicy, multiSourceThreshold,
                    CoOccurrenceEstimator.independentProduct(memberRates)));
        }
        LOG.debug("Clustered {} anomalies: {} edges, {} components, {} clusters",
                n, edges, byRoot.size(), clusters.size());
        return clusters;
    }

    /**
     * @return clusters in ranking order with ranks 1..n
     */
    public List<Cluster> rankClusters(List<Cluster> clusters) {
        Objects.requireNonNull(clusters, "clusters must not be null");
        List<Cluster> ordered = new ArrayList<>(clusters);
        ordered.sort(RANKING);
        List<Cluster> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ranked.add(ordered.get(i).withRank(i + 1));
        }
        return ranked;
    }

    /**
     * @return the multi-source subset, order preserved
     */
    public List<Cluster> getMultiSourceClusters(List<Cluster> clusters) {
        return clusters.stream().filter(Cluster::isMultiSource).toList();
    }

    /**
     * Find, rank and summarise clusters in one pass.
     */
    public ClusterReport analyze(List<AnomalyEvent> anomalies) {
        List<Cluster> ranked = rankClusters(findClusters(anomalies));
        return new ClusterReport(ranked, getMultiSourceClusters(ranked));
    }

    /**
     * Rate of each source across the table: its share of windows containing
     * one of its anomalies.
     */
    private Map<String, Double> sourceRates(List<AnomalyEvent> sorted) {
        double spanSeconds = (sorted.get(sorted.size() - 1).getTimestamp().toEpochMilli()
                - sorted.get(0).getTimestamp().toEpochMilli()) / 1000.0;
        double windows = Math.max(1.0, spanSeconds / Math.max(windowSeconds, 1.0));
        Map<String, Integer> counts = new HashMap<>();
        for (AnomalyEvent a : sorted) {
            counts.merge(a.getSensorSource(), 1, Integer::sum);
        }
        Map<String, Double> rates = new HashMap<>();
        counts.forEach((source, count) -> rates.put(source, Math.min(1.0, count / windows)));
        return rates;
    }

    public double getWindowSeconds() {
        return windowSeconds;
    }

    public int getMinClusterSize() {
        return minClusterSize;
    }

    public int getMultiSourceThreshold() {
        return multiSourceThreshold;
    }
}
