package com.matrixwatcher.runtime;

import com.matrixwatcher.core.bus.EventBus;
import com.matrixwatcher.core.model.Event;
import com.matrixwatcher.core.model.EventType;
import com.matrixwatcher.core.model.Severity;
import com.matrixwatcher.core.scheduler.CancellationToken;
import com.matrixwatcher.core.scheduler.Scheduler;
import com.matrixwatcher.core.scheduler.TaskHandler;
import com.matrixwatcher.core.scheduler.TaskStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pauses tasks that keep failing.
 *
 * <p>
 * The scheduler only records failures. On every {@link #check()} this
 * monitor pauses each task whose consecutive failure count has reached the
 * threshold and publishes one {@link Severity#CRITICAL} {@link EventType#HEALTH}
 * event per paused task. Paused tasks stay paused until someone calls
 * {@link Scheduler#resumeTask(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public class TaskHealthMonitor implements TaskHandler {

    private static final Logger LOG = LoggerFactory.getLogger(TaskHealthMonitor.class);

    static final String SOURCE = "health_monitor";

    private final Scheduler scheduler;
    private final EventBus bus;
    private final int failureThreshold;
    private final Clock clock;

    /**
     * @param failureThreshold consecutive failures that pause a task; must be
     *                         &gt;= 1
     */
    public TaskHealthMonitor(Scheduler scheduler, EventBus bus, int failureThreshold, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler must not be null");
        this.bus = Objects.requireNonNull(bus, "EventBus must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
    }

    @Override
    public void run(CancellationToken token) {
        check();
    }

    /**
     * @return names of the tasks paused by this call
     */
    public List<String> check() {
        List<String> paused = new ArrayList<>();
        for (Map.Entry<String, TaskStats> entry : scheduler.getAllTaskStats().entrySet()) {
            String name = entry.getKey();
            TaskStats stats = entry.getValue();
            if (stats.getConsecutiveFailures() < failureThreshold) {
                continue;
            }
            if (scheduler.isTaskPaused(name) || !scheduler.pauseTask(name)) {
                continue;
            }
            paused.add(name);
            LOG.warn("Task '{}' paused after {} consecutive failures (last error: {})",
                    name, stats.getConsecutiveFailures(), stats.getLastError());
            publishPaused(name, stats);
        }
        return paused.isEmpty() ? Collections.emptyList() : paused;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    private void publishPaused(String name, TaskStats stats) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task", name);
        payload.put("action", "paused");
        payload.put("consecutive_failures", stats.getConsecutiveFailures());
        payload.put("error_count", stats.getErrorCount());
        payload.put("last_error", stats.getLastError());
        try {
            bus.publish(Event.builder()
                    .source(SOURCE)
                    .eventType(EventType.HEALTH)
                    .severity(Severity.CRITICAL)
                    .timestamp(clock.instant())
                    .payload(payload)
                    .build());
        } catch (RuntimeException e) {
            LOG.error("Failed to publish health event for task '{}'", name, e);
        }
    }
}
