package com.matrixwatcher.core.pipeline;

import com.matrixwatcher.core.model.AnomalyEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyIndexCalculator}.
 */
class AnomalyIndexCalculatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private AnomalyIndexCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new AnomalyIndexCalculator();
    }

    @Test
    @DisplayName("Should score each source by its strongest deviation")
    void shouldScorePerSource() {
        AnomalyIndex index = calculator.calculate(List.of(
                anomaly("crypto", 2.0), anomaly("crypto", -3.0), anomaly("news", 1.0)), T0);

        assertThat(index.getBreakdown()).containsEntry("crypto", 15.0).containsEntry("news", 5.0);
        assertThat(index.getIndex()).isEqualTo(20.0);
        assertThat(index.getStatus()).isEqualTo("normal");
        assertThat(index.getBaselineRatio()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should cap source points at 25 and the index at 100")
    void shouldCapScores() {
        AnomalyIndex index = calculator.calculate(List.of(
                anomaly("a", 10), anomaly("b", 10), anomaly("c", 10), anomaly("d", 10), anomaly("e", 10)), T0);

        assertThat(index.getBreakdown().values()).containsOnly(25.0);
        assertThat(index.getIndex()).isEqualTo(100.0);
        assertThat(index.getStatus()).isEqualTo("critical");
    }

    @Test
    @DisplayName("Should compare the index with the mean of recent scores")
    void shouldComputeBaselineRatio() {
        calculator.calculate(List.of(anomaly("a", 10), anomaly("b", 10)), T0);

        AnomalyIndex second = calculator.calculate(List.of(anomaly("a", 5)), T0.plus(Duration.ofHours(1)));

        assertThat(second.getIndex()).isEqualTo(25.0);
        assertThat(second.getBaselineRatio()).isCloseTo(0.5, within(1e-12));
        assertThat(calculator.getHistorySize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should forget scores older than the baseline window")
    void shouldExpireBaseline() {
        calculator.calculate(List.of(anomaly("a", 10)), T0);
        calculator.calculate(List.of(anomaly("a", 10)), T0.plus(Duration.ofHours(1)));

        AnomalyIndex later = calculator.calculate(List.of(anomaly("a", 2)), T0.plus(Duration.ofHours(30)));

        assertThat(later.getBaselineRatio()).isEqualTo(1.0);
        assertThat(calculator.getHistorySize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should map the index onto four status bands")
    void shouldMapStatus() {
        assertThat(AnomalyIndexCalculator.statusOf(24.9)).isEqualTo("normal");
        assertThat(AnomalyIndexCalculator.statusOf(25)).isEqualTo("elevated");
        assertThat(AnomalyIndexCalculator.statusOf(50)).isEqualTo("high");
        assertThat(AnomalyIndexCalculator.statusOf(75)).isEqualTo("critical");
    }

    @Test
    @DisplayName("Should score an empty group as zero and reject a non-positive window")
    void shouldHandleEdgeCases() {
        AnomalyIndex empty = calculator.calculate(List.of(), T0);

        assertThat(empty.getIndex()).isZero();
        assertThat(empty.toMap()).containsKeys("index", "status", "baseline_ratio", "breakdown");
        assertThatThrownBy(() -> new AnomalyIndexCalculator(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyEvent anomaly(String source, double z) {
        return AnomalyEvent.builder()
                .timestamp(T0)
                .sensorSource(source)
                .parameter("value")
                .zScore(z)
                .build();
    }
}
