package com.matrixwatcher.core.cluster;

import com.matrixwatcher.core.model.AnomalyEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ClusterAnalyzer}.
 */
class ClusterAnalyzerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private ClusterAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ClusterAnalyzer(3.0, 2, 3);
    }

    @Test
    @DisplayName("Should find two clusters and drop the isolated anomaly")
    void shouldFindComponents() {
        List<Cluster> clusters = analyzer.findClusters(fixture());

        assertThat(clusters).hasSize(2);
        Cluster first = clusters.get(0);
        assertThat(first.getAnomalyCount()).isEqualTo(3);
        assertThat(first.getSources()).containsExactly("a", "b", "c");
        assertThat(first.getTimeSpanSeconds()).isEqualTo(2.0);
        assertThat(first.getLevel()).isEqualTo(3);
        assertThat(first.getRank()).isZero();

        Cluster second = clusters.get(1);
        assertThat(second.getAnomalyCount()).isEqualTo(4);
        assertThat(second.getSources()).containsExactly("a", "b", "c", "d");
        assertThat(second.getStartTime()).isEqualTo(T0.plusSeconds(100));
        assertThat(second.getEndTime()).isEqualTo(T0.plusSeconds(103));
        assertThat(second.getLevel()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should rank by source diversity and assign ranks from 1")
    void shouldRankClusters() {
        List<Cluster> ranked = analyzer.rankClusters(analyzer.findClusters(fixture()));

        assertThat(ranked).extracting(Cluster::getRank).containsExactly(1, 2);
        assertThat(ranked.get(0).getUniqueSources()).isEqualTo(4);
        assertThat(ranked.get(1).getUniqueSources()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should prefer larger then tighter clusters when diversity ties")
    void shouldBreakRankingTies() {
        List<AnomalyEvent> table = new ArrayList<>();
        table.add(anomaly(0, "a"));
        table.add(anomaly(3, "b"));
        table.add(anomaly(50, "a"));
        table.add(anomaly(51, "b"));
        table.add(anomaly(100, "a"));
        table.add(anomaly(101, "b"));
        table.add(anomaly(102, "b"));

        List<Cluster> ranked = analyzer.rankClusters(analyzer.findClusters(table));

        assertThat(ranked).hasSize(3);
        assertThat(ranked.get(0).getAnomalyCount()).isEqualTo(3);
        assertThat(ranked.get(1).getTimeSpanSeconds()).isEqualTo(1.0);
        assertThat(ranked.get(2).getTimeSpanSeconds()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should join anomalies exactly one window apart")
    void shouldTreatWindowAsInclusive() {
        List<Cluster> clusters = analyzer.findClusters(List.of(anomaly(0, "a"), anomaly(3, "b")));

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getTimeSpanSeconds()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should return nothing for empty input or scattered anomalies")
    void shouldHandleEmptyAndSparseInput() {
        ClusterAnalyzer narrow = new ClusterAnalyzer(2.0, 2, 3);

        assertThat(analyzer.findClusters(List.of())).isEmpty();
        assertThat(narrow.findClusters(List.of(anomaly(0, "a"), anomaly(100, "b"), anomaly(200, "c"))))
                .isEmpty();
    }

    @Test
    @DisplayName("Should report a lone anomaly as a level 1 cluster when the minimum is 1")
    void shouldReportSingletonsWithMinimumOne() {
        ClusterAnalyzer singles = new ClusterAnalyzer(3.0, 1, 3);

        List<Cluster> clusters = singles.findClusters(List.of(anomaly(0, "a")));

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getLevel()).isEqualTo(1);
        assertThat(clusters.get(0).isMultiSource()).isFalse();
        assertThat(clusters.get(0).getTimeSpanSeconds()).isZero();
    }

    @Test
    @DisplayName("Should sort unsorted input before clustering")
    void shouldSortInput() {
        List<AnomalyEvent> shuffled = new ArrayList<>(fixture());
        Collections.reverse(shuffled);

        List<Cluster> clusters = analyzer.findClusters(shuffled);

        assertThat(clusters).hasSize(2);
        assertThat(clusters.get(0).getStartTime()).isEqualTo(T0);
        assertThat(clusters.get(0).getSources()).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Should flag multi-source clusters by threshold")
    void shouldFlagMultiSource() {
        ClusterAnalyzer strict = new ClusterAnalyzer(3.0, 2, 4);

        List<Cluster> clusters = strict.findClusters(fixture());

        assertThat(strict.getMultiSourceClusters(clusters)).hasSize(1);
        assertThat(strict.getMultiSourceClusters(clusters).get(0).getUniqueSources()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should produce a report with ranked clusters and a summary")
    void shouldAnalyze() {
        ClusterReport report = analyzer.analyze(fixture());

        assertThat(report.getTotalClusters()).isEqualTo(2);
        assertThat(report.getMultiSourceCount()).isEqualTo(2);
        assertThat(report.getSummary()).hasSize(2);
        assertThat(report.getSummary().get(0))
                .containsEntry("rank", 1)
                .containsEntry("sources", "a, b, c, d")
                .containsEntry("anomaly_count", 4);

        Map<String, Object> map = report.toMap();
        assertThat(map).containsKeys("clusters", "multi_source_clusters", "summary",
                "total_clusters", "multi_source_count");
        assertThat(map.get("total_clusters")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep co-occurrence probability within percent bounds")
    void shouldEstimateCoOccurrence() {
        for (Cluster c : analyzer.findClusters(fixture())) {
            assertThat(c.getCoOccurrenceProbability()).isBetween(0.0, 100.0);
        }
    }

    @Test
    @DisplayName("Should reject invalid construction arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new ClusterAnalyzer(-1, 2, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ClusterAnalyzer(30, 0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ClusterAnalyzer(30, 2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.findClusters(null)).isInstanceOf(NullPointerException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<AnomalyEvent> fixture() {
        long[] seconds = { 0, 1, 2, 100, 101, 102, 103, 200 };
        String[] sources = { "a", "b", "c", "a", "b", "c", "d", "a" };
        List<AnomalyEvent> table = new ArrayList<>();
        for (int i = 0; i < seconds.length; i++) {
            table.add(anomaly(seconds[i], sources[i]));
        }
        return table;
    }

    static AnomalyEvent anomaly(long offsetSeconds, String source) {
        return AnomalyEvent.builder()
                .timestamp(T0.plusSeconds(offsetSeconds))
                .sensorSource(source)
                .parameter("value")
                .value(10)
                .mean(1)
                .std(1)
                .zScore(9)
                .build();
    }
}
