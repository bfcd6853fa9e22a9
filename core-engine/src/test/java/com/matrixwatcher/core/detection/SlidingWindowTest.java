package com.matrixwatcher.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SlidingWindow}.
 */
class SlidingWindowTest {

    @Test
    @DisplayName("Should hold at most maxSize values and be full after maxSize inserts")
    void shouldStayBounded() {
        Random random = new Random(42);
        for (int n : new int[] {2, 5, 17, 100}) {
            SlidingWindow window = new SlidingWindow(n);
            for (int i = 0; i < n * 3; i++) {
                window.add(random.nextGaussian());
                assertThat(window.size()).isLessThanOrEqualTo(n);
                if (i + 1 >= n) {
                    assertThat(window.size()).isEqualTo(n);
                }
            }
        }
    }

    @Test
    @DisplayName("Should evict the oldest value first")
    void shouldEvictOldest() {
        SlidingWindow window = new SlidingWindow(3);
        for (double v : new double[] {1, 2, 3, 4}) {
            window.add(v);
        }

        assertThat(window.toArray()).containsExactly(2, 3, 4);
    }

    @Test
    @DisplayName("Should use the sample standard deviation")
    void shouldUseSampleStd() {
        SlidingWindow window = new SlidingWindow(10);
        for (double v : new double[] {2, 4, 4, 4, 5, 5, 7, 9}) {
            window.add(v);
        }

        assertThat(window.mean()).isEqualTo(5.0);
        assertThat(window.std()).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
    }

    @Test
    @DisplayName("Should compute z as (v - mean) / std")
    void shouldComputeZScore() {
        SlidingWindow window = new SlidingWindow(10);
        for (double v : new double[] {10, 12, 14}) {
            window.add(v);
        }

        assertThat(window.zScore(16).getAsDouble()).isCloseTo((16 - 12) / 2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should have no z-score with fewer than two samples or zero deviation")
    void shouldHandleDegenerateWindows() {
        SlidingWindow window = new SlidingWindow(5);
        assertThat(window.zScore(1)).isEmpty();
        window.add(3);
        assertThat(window.zScore(1)).isEmpty();
        window.add(3);
        assertThat(window.zScore(100)).isEmpty();
        assertThatThrownBy(() -> new SlidingWindow(1)).isInstanceOf(IllegalArgumentException.class);
    }
}
