package com.matrixwatcher.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuntimeConfig}.
 */
class RuntimeConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        RuntimeConfig config = new RuntimeConfig.Builder().build();

        assertThat(config.getWatcherConfigPath()).isEmpty();
        assertThat(config.getPatternStorageDir()).isEqualTo("data/patterns");
        assertThat(config.patternStoragePath()).isEqualTo(Path.of("data/patterns"));
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.healthCheckInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.persistInterval()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.getTaskFailureThreshold()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should apply builder overrides")
    void shouldApplyOverrides() {
        RuntimeConfig config = new RuntimeConfig.Builder()
                .watcherConfigPath("/etc/watcher.yml")
                .patternStorageDir("/var/lib/watcher")
                .healthPort(9090)
                .healthCheckIntervalSeconds(15)
                .persistIntervalSeconds(30)
                .taskFailureThreshold(2)
                .build();

        assertThat(config.getWatcherConfigPath()).isEqualTo("/etc/watcher.yml");
        assertThat(config.getHealthPort()).isEqualTo(9090);
        assertThat(config.healthCheckInterval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.persistInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getTaskFailureThreshold()).isEqualTo(2);
        assertThat(config.toString()).contains("healthPort=9090", "/var/lib/watcher");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new RuntimeConfig.Builder().healthPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new RuntimeConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RuntimeConfig.Builder().persistIntervalSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("persistIntervalSeconds");
        assertThatThrownBy(() -> new RuntimeConfig.Builder().healthCheckIntervalSeconds(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RuntimeConfig.Builder().taskFailureThreshold(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("taskFailureThreshold");
    }

    @Test
    @DisplayName("Should reject a blank storage directory")
    void shouldRejectBlankStorageDir() {
        assertThatThrownBy(() -> new RuntimeConfig.Builder().patternStorageDir(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("patternStorageDir");
        assertThatThrownBy(() -> new RuntimeConfig.Builder().watcherConfigPath(null).build())
                .isInstanceOf(NullPointerException.class);
    }
}
