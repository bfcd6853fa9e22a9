package com.matrixwatcher.runtime;

import com.matrixwatcher.core.bus.EventBus;
import com.matrixwatcher.core.config.WatcherSettings;
import com.matrixwatcher.core.model.Priority;
import com.matrixwatcher.core.model.SensorReading;
import com.matrixwatcher.core.pattern.HistoricalPatternTracker;
import com.matrixwatcher.core.pattern.PatternRepository;
import com.matrixwatcher.core.pipeline.AnomalyIndexCalculator;
import com.matrixwatcher.core.pipeline.ObservationPipeline;
import com.matrixwatcher.core.scheduler.Scheduler;
import com.matrixwatcher.core.scheduler.TaskHandler;
import com.matrixwatcher.core.scheduler.TaskStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point and process wiring of the watcher.
 *
 * <h3>Components</h3>
 *
 * <pre>
 *   SensorCollector (scheduled per sensor)
 *     → ObservationPipeline
 *         → AnomalyDetector → ClusterDetector → HistoricalPatternTracker
 *         → EventBus (DATA / ANOMALY / CLUSTER / ALERT)
 *   housekeeping tasks: pattern persistence, task health check, cluster expiry
 *   HealthServer: /health, /readiness, /status
 * </pre>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} restores learned patterns, registers the housekeeping
 * tasks and starts the scheduler and the health server. {@link #stop()}
 * stops the scheduler, closes any open cluster and flushes the patterns.
 * Sensors may be registered before or after start.
 * </p>
 *
 * @since 1.0.0
 */
public class MatrixWatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MatrixWatcher.class);

    public static final String PERSIST_TASK = "pattern_persistence";
    public static final String HEALTH_TASK = "task_health_check";
    public static final String EXPIRY_TASK = "cluster_expiry";

    private static final Set<String> RESERVED_TASKS = Set.of(PERSIST_TASK, HEALTH_TASK, EXPIRY_TASK);

    private final RuntimeConfig config;
    private final Clock clock;
    private final EventBus bus;
    private final Scheduler scheduler;
    private final HistoricalPatternTracker tracker;
    private final ObservationPipeline pipeline;
    private final TaskHealthMonitor healthMonitor;
    private final HealthServer healthServer;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile Instant startedAt;

    public MatrixWatcher(WatcherSettings settings, RuntimeConfig config, Clock clock) {
        this(settings, config, new JsonPatternRepository(config.patternStoragePath()), clock);
    }

    /**
     * @param repository pattern storage; {@code null} keeps patterns in memory
     */
    public MatrixWatcher(WatcherSettings settings, RuntimeConfig config, PatternRepository repository,
            Clock clock) {
        Objects.requireNonNull(settings, "WatcherSettings must not be null");
        this.config = Objects.requireNonNull(config, "RuntimeConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");

        this.bus = settings.newEventBus();
        this.scheduler = settings.newScheduler();
        this.tracker = new HistoricalPatternTracker(settings.newEventRegistry(), settings.trackerSettings(),
                repository, clock);
        this.pipeline = new ObservationPipeline(settings.newAnomalyDetector(), settings.newClusterDetector(),
                tracker, bus, new AnomalyIndexCalculator(), settings.getPatterns().getMinConditionLevel(), clock);
        this.healthMonitor = new TaskHealthMonitor(scheduler, bus, config.getTaskFailureThreshold(), clock);
        this.healthServer = new HealthServer(this::isReady, this::statusSnapshot);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public void start() {
        if (!started.compareAndSet(false, true)) {
            LOG.warn("Matrix Watcher already started");
            return;
        }
        tracker.init();

        scheduler.registerTask(PERSIST_TASK, token -> persist(), config.persistInterval(), Priority.LOW);
        scheduler.registerTask(HEALTH_TASK, healthMonitor, config.healthCheckInterval(), Priority.MEDIUM);
        scheduler.registerTask(EXPIRY_TASK, token -> pipeline.expireClusters(), Priority.HIGH);

        scheduler.start();
        healthServer.start(config.getHealthPort());
        startedAt = clock.instant();
        LOG.info("Matrix Watcher started with {} task(s)", scheduler.getTaskCount());
    }

    /**
     * Stop scheduling, close the open cluster and flush patterns. Safe to call
     * more than once.
     */
    public void stop() {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Stopping Matrix Watcher");
        scheduler.stop();
        pipeline.expireClusters();
        tracker.shutdown();
        healthServer.stop();
        LOG.info("Matrix Watcher stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isReady() {
        return started.get() && !stopped.get() && scheduler.isRunning();
    }

    // ---------------------------------------------------------------
    // Sensors
    // ---------------------------------------------------------------

    /**
     * Poll a sensor on a schedule and feed its readings through the pipeline.
     *
     * @param name      task name; must not clash with a housekeeping task
     * @param collector reading source
     * @param interval  poll interval; {@code null} uses the priority default
     * @param priority  dispatch priority; {@code null} means medium
     * @throws IllegalArgumentException if {@code name} is reserved
     */
    public void registerSensor(String name, SensorCollector collector, Duration interval, Priority priority) {
        Objects.requireNonNull(name, "Sensor name must not be null");
        Objects.requireNonNull(collector, "SensorCollector must not be null");
        if (RESERVED_TASKS.contains(name)) {
            throw new IllegalArgumentException("Sensor name is reserved: " + name);
        }
        TaskHandler poll = token -> {
            List<SensorReading> readings = collector.collect(token);
            if (readings == null) {
                return;
            }
            for (SensorReading reading : readings) {
                if (token.shouldStop()) {
                    LOG.debug("Sensor '{}' stopped with unprocessed readings", name);
                    return;
                }
                pipeline.process(reading);
            }
        };
        Priority effective = priority != null ? priority : Priority.MEDIUM;
        if (interval == null) {
            scheduler.registerTask(name, poll, effective);
        } else {
            scheduler.registerTask(name, poll, interval, effective);
        }
        LOG.info("Sensor '{}' registered", name);
    }

    public boolean unregisterSensor(String name) {
        if (name == null || RESERVED_TASKS.contains(name)) {
            return false;
        }
        return scheduler.unregisterTask(name);
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    /**
     * @return plain-data snapshot served on {@code /status}
     */
    public Map<String, Object> statusSnapshot() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", isReady() ? "UP" : "NOT_READY");
        status.put("started_at", startedAt);
        status.put("pipeline", pipeline.getStats().toMap());
        status.put("bus", bus.getStats().toMap());
        Map<String, Object> tasks = new LinkedHashMap<>();
        for (Map.Entry<String, TaskStats> e : scheduler.getAllTaskStats().entrySet()) {
            Map<String, Object> task = new LinkedHashMap<>(e.getValue().toMap());
            scheduler.getTaskState(e.getKey()).ifPresent(s -> task.put("state", s.name().toLowerCase()));
            tasks.put(e.getKey(), task);
        }
        status.put("tasks", tasks);
        status.put("calibration", tracker.getCalibrationStats().toMap());
        status.put("pattern_groups", tracker.getPatternGroupCount());
        status.put("recent_conditions", tracker.getRecentConditionCount());
        return status;
    }

    public EventBus getBus() {
        return bus;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public HistoricalPatternTracker getTracker() {
        return tracker;
    }

    public ObservationPipeline getPipeline() {
        return pipeline;
    }

    public TaskHealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void persist() {
        if (!tracker.save()) {
            LOG.debug("Patterns not saved this round");
        }
    }

    // ---------------------------------------------------------------
    // Entry point
    // ---------------------------------------------------------------

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        RuntimeConfig config = RuntimeConfig.fromEnvironment();
        LOG.info("Starting Matrix Watcher with config: {}", config);

        // 2. Load analysis settings
        WatcherSettings settings = SettingsLoader.load(config.getWatcherConfigPath());

        // 3. Wire components and the local system sensor
        Clock clock = Clock.systemUTC();
        MatrixWatcher watcher = new MatrixWatcher(settings, config, clock);
        Duration systemInterval = settings.priorityIntervals().get(Priority.HIGH);
        watcher.registerSensor(SystemSensor.SOURCE, new SystemSensor(systemInterval, clock), systemInterval,
                Priority.HIGH);

        // 4. Stop cleanly on SIGTERM / Ctrl-C
        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            watcher.stop();
            terminated.countDown();
        }, "watcher-shutdown"));

        // 5. Run until shut down
        watcher.start();
        terminated.await();
    }
}
