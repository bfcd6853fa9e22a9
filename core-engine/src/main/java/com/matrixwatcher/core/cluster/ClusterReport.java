package com.matrixwatcher.core.cluster;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link ClusterAnalyzer#analyze}.
 *
 * @since 1.0.0
 */
public final class ClusterReport {

    private final List<Cluster> clusters;
    private final List<Cluster> multiSourceClusters;

    ClusterReport(List<Cluster> clusters, List<Cluster> multiSourceClusters) {
        this.clusters = List.copyOf(clusters);
        this.multiSourceClusters = List.copyOf(multiSourceClusters);
    }

    /**
     * @return ranked clusters
     */
    public List<Cluster> getClusters() {
        return clusters;
    }

    public List<Cluster> getMultiSourceClusters() {
        return multiSourceClusters;
    }

    public int getTotalClusters() {
        return clusters.size();
    }

    public int getMultiSourceCount() {
        return multiSourceClusters.size();
    }

    /**
     * One compact row per ranked cluster, without member details.
     */
    public List<Map<String, Object>> getSummary() {
        List<Map<String, Object>> rows = new ArrayList<>(clusters.size());
        for (Cluster c : clusters) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("rank", c.getRank());
            row.put("level", c.getLevel());
            row.put("start_time", c.getStartTime().toString());
            row.put("time_span_seconds", c.getTimeSpanSeconds());
            row.put("anomaly_count", c.getAnomalyCount());
            row.put("unique_sources", c.getUniqueSources());
            row.put("sources", String.join(", ", c.getSources()));
            row.put("is_multi_source", c.isMultiSource());
            rows.add(row);
        }
        return rows;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("clusters", clusters.stream().map(Cluster::toMap).toList());
        m.put("multi_source_clusters", multiSourceClusters.stream().map(Cluster::toMap).toList());
        m.put("summary", getSummary());
        m.put("total_clusters", getTotalClusters());
        m.put("multi_source_count", getMultiSourceCount());
        return m;
    }

    @Override
    public String toString() {
        return "ClusterReport{total=" + getTotalClusters() + ", multiSource=" + getMultiSourceCount() + '}';
    }
}
