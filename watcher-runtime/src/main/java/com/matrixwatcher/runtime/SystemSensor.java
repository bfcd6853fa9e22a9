package com.matrixwatcher.runtime;

import com.matrixwatcher.core.model.SensorReading;
import com.matrixwatcher.core.scheduler.CancellationToken;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Local host sensor: loop timing drift, CPU and memory load of the process
 * host.
 *
 * <p>
 * {@code loop_drift_ms} is the difference between the actual and the
 * expected time since the previous poll; scheduling hiccups show up there
 * first. CPU and memory fields are omitted when the platform bean does not
 * expose them.
 * </p>
 *
 * @since 1.0.0
 */
public class SystemSensor implements SensorCollector {

    public static final String SOURCE = "system";

    private final Duration expectedInterval;
    private final Clock clock;
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final RuntimeMXBean runtimeBean = ManagementFactory.getRuntimeMXBean();

    private Instant lastPoll;

    public SystemSensor(Duration expectedInterval, Clock clock) {
        this.expectedInterval = Objects.requireNonNull(expectedInterval, "expectedInterval must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (expectedInterval.isNegative() || expectedInterval.isZero()) {
            throw new IllegalArgumentException("expectedInterval must be positive, got: " + expectedInterval);
        }
    }

    @Override
    public synchronized List<SensorReading> collect(CancellationToken token) {
        Instant now = clock.instant();
        double intervalMs = lastPoll == null
                ? expectedInterval.toMillis()
                : Duration.between(lastPoll, now).toNanos() / 1_000_000.0;
        lastPoll = now;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("local_time_unix", now.toEpochMilli() / 1000.0);
        data.put("loop_interval_ms", intervalMs);
        data.put("loop_drift_ms", Math.max(0.0, intervalMs - expectedInterval.toMillis()));
        cpuUsagePercent().ifPresent(v -> data.put("cpu_usage_percent", v));
        ramUsagePercent().ifPresent(v -> data.put("ram_usage_percent", v));
        data.put("heap_usage_percent", heapUsagePercent());
        double loadAverage = osBean.getSystemLoadAverage();
        if (loadAverage >= 0) {
            data.put("system_load_average", loadAverage);
        }
        data.put("process_pid", ProcessHandle.current().pid());
        data.put("process_uptime_seconds", runtimeBean.getUptime() / 1000.0);
        return List.of(new SensorReading(SOURCE, now, data));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<Double> cpuUsagePercent() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            double load = sunBean.getCpuLoad();
            if (load >= 0) {
                return Optional.of(load * 100.0);
            }
        }
        return Optional.empty();
    }

    private Optional<Double> ramUsagePercent() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            long total = sunBean.getTotalMemorySize();
            if (total > 0) {
                return Optional.of(100.0 * (total - sunBean.getFreeMemorySize()) / total);
            }
        }
        return Optional.empty();
    }

    private double heapUsagePercent() {
        long max = memoryBean.getHeapMemoryUsage().getMax();
        long used = memoryBean.getHeapMemoryUsage().getUsed();
        return max > 0 ? 100.0 * used / max : 0.0;
    }
}
