package com.matrixwatcher.core.cluster;

import com.matrixwatcher.core.model.AnomalyEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ClusterDetector}.
 */
class ClusterDetectorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private ClusterDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ClusterDetector(30.0, 2, 3, new LevelPolicy(), new CoOccurrenceEstimator());
    }

    @Test
    @DisplayName("Should report nothing until the open cluster reaches the minimum size")
    void shouldWaitForMinimumSize() {
        assertThat(detector.addAnomaly(anomaly(0, "crypto"))).isEmpty();
        assertThat(detector.getCurrentCluster()).isEmpty();

        Optional<Cluster> cluster = detector.addAnomaly(anomaly(10, "earthquake"));

        assertThat(cluster).isPresent();
        assertThat(cluster.get().getSources()).containsExactly("crypto", "earthquake");
        assertThat(cluster.get().getLevel()).isEqualTo(2);
        assertThat(detector.getCurrentCluster()).isPresent();
    }

    @Test
    @DisplayName("Should grow the open cluster with every anomaly in reach")
    void shouldGrowOpenCluster() {
        detector.addAnomaly(anomaly(0, "a"));
        detector.addAnomaly(anomaly(25, "b"));

        Cluster cluster = detector.addAnomaly(anomaly(50, "c")).orElseThrow();

        assertThat(cluster.getAnomalyCount()).isEqualTo(3);
        assertThat(cluster.getTimeSpanSeconds()).isEqualTo(50.0);
        assertThat(cluster.isMultiSource()).isTrue();
        assertThat(cluster.getLevel()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should close the open cluster when an anomaly arrives out of reach")
    void shouldCloseOnGap() {
        detector.addAnomaly(anomaly(0, "a"));
        detector.addAnomaly(anomaly(10, "b"));

        Optional<Cluster> result = detector.addAnomaly(anomaly(100, "c"));

        assertThat(result).isEmpty();
        assertThat(detector.getOpenSize()).isEqualTo(1);
        assertThat(detector.getRecentClusters()).hasSize(1);
        assertThat(detector.getRecentClusters().get(0).getSources()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should admit a late anomaly that falls before the open range")
    void shouldAdmitLateAnomaly() {
        detector.addAnomaly(anomaly(100, "a"));

        Cluster cluster = detector.addAnomaly(anomaly(80, "b")).orElseThrow();

        assertThat(cluster.getStartTime()).isEqualTo(T0.plusSeconds(80));
        assertThat(cluster.getSources()).containsExactly("b", "a");
    }

    @Test
    @DisplayName("Should expire the open cluster only after the window has passed")
    void shouldExpire() {
        detector.addAnomaly(anomaly(0, "a"));
        detector.addAnomaly(anomaly(5, "b"));

        assertThat(detector.expire(T0.plusSeconds(35))).isEmpty();
        assertThat(detector.getOpenSize()).isEqualTo(2);

        Optional<Cluster> closed = detector.expire(T0.plusSeconds(36));

        assertThat(closed).isPresent();
        assertThat(closed.get().getAnomalyCount()).isEqualTo(2);
        assertThat(detector.getOpenSize()).isZero();
        assertThat(detector.expire(T0.plusSeconds(500))).isEmpty();
    }

    @Test
    @DisplayName("Should discard an undersized open component on expiry")
    void shouldDiscardSmallComponentOnExpiry() {
        detector.addAnomaly(anomaly(0, "a"));

        assertThat(detector.expire(T0.plusSeconds(60))).isEmpty();
        assertThat(detector.getOpenSize()).isZero();
        assertThat(detector.getRecentClusters()).isEmpty();
    }

    @Test
    @DisplayName("Should cap the retained closed clusters")
    void shouldCapRecentClusters() {
        for (int i = 0; i < ClusterDetector.RECENT_CLUSTER_CAPACITY + 5; i++) {
            detector.addAnomaly(anomaly(i * 1000L, "a"));
            detector.addAnomaly(anomaly(i * 1000L + 1, "b"));
        }
        detector.expire(T0.plusSeconds(10_000_000));

        assertThat(detector.getRecentClusters()).hasSize(ClusterDetector.RECENT_CLUSTER_CAPACITY);
    }

    @Test
    @DisplayName("Should forget everything on clear")
    void shouldClear() {
        detector.addAnomaly(anomaly(0, "a"));
        detector.addAnomaly(anomaly(1, "b"));
        detector.addAnomaly(anomaly(100, "c"));

        detector.clear();

        assertThat(detector.getOpenSize()).isZero();
        assertThat(detector.getRecentClusters()).isEmpty();
        assertThat(detector.getCurrentCluster()).isEmpty();
    }

    @Test
    @DisplayName("Should reject null anomalies and invalid arguments")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> detector.addAnomaly(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ClusterDetector(-1, 2, 3, new LevelPolicy(), new CoOccurrenceEstimator()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ClusterDetector(30, 0, 3, new LevelPolicy(), new CoOccurrenceEstimator()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyEvent anomaly(long offsetSeconds, String source) {
        return AnomalyEvent.builder()
                .timestamp(T0.plusSeconds(offsetSeconds))
                .sensorSource(source)
                .parameter("value")
                .value(10)
                .zScore(5)
                .build();
    }
}
