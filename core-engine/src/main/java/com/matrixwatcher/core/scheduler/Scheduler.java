package com.matrixwatcher.core.scheduler;

import com.matrixwatcher.core.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Priority-aware runner for named, repeating tasks.
 *
 * <h3>Model</h3>
 * <p>
 * A single loop thread wakes every tick, collects the <em>ready</em> tasks
 * (not paused, not running, interval elapsed since the previous start),
 * orders them by priority and registration order, and hands them to a fixed
 * worker pool of {@code maxConcurrent} threads. A task that is running is
 * never ready, so it can not overlap with itself. When fewer slots are free
 * than tasks are ready, higher priorities win.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Exceptions and errors thrown by a handler are recorded in its
 * {@link TaskStats} and logged; they never reach the loop thread. Only a
 * {@link VirtualMachineError} propagates to the worker. The scheduler does not disable
 * failing tasks on its own; a health monitor may {@link #pauseTask(String)}
 * them.
 * </p>
 *
 * <h3>Cancellation</h3>
 * <p>
 * Each execution receives a {@link CancellationToken} that is cancelled on
 * unregister, replacement or {@link #stop()}, and that expires after the
 * task's optional timeout. Unregister and pause never interrupt a running
 * handler. {@link #stop()} waits five seconds for workers to return and then
 * interrupts the ones still running.
 * </p>
 *
 * @since 1.0.0
 */
public class Scheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Scheduler.class);

    public static final Duration MIN_INTERVAL = Duration.ofMillis(100);
    public static final Duration MAX_INTERVAL = Duration.ofHours(1);
    public static final Duration DEFAULT_TICK = Duration.ofMillis(50);
    public static final int DEFAULT_MAX_CONCURRENT = 4;

    private static final Duration STOP_GRACE = Duration.ofSeconds(5);

    private static final Comparator<ScheduledTask> DISPATCH_ORDER = Comparator
            .comparingInt((ScheduledTask t) -> t.getPriority().rank())
            .thenComparingLong(ScheduledTask::getSequence);

    private final int maxConcurrent;
    private final Duration tick;
    private final Map<Priority, Duration> defaultIntervals;

    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Semaphore slots;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ExecutorService workers;
    private Thread loopThread;

    public Scheduler() {
        this(DEFAULT_MAX_CONCURRENT);
    }

    public Scheduler(int maxConcurrent) {
        this(maxConcurrent, defaultPriorityIntervals(), DEFAULT_TICK);
    }

    /**
     * @param maxConcurrent    worker pool size; must be &gt;= 1
     * @param defaultIntervals interval used when a task is registered without
     *                         one
     * @param tick             pause between readiness checks
     * @throws IllegalArgumentException if {@code maxConcurrent} &lt; 1 or
     *                                  {@code tick} is not positive
     */
    public Scheduler(int maxConcurrent, Map<Priority, Duration> defaultIntervals, Duration tick) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got: " + maxConcurrent);
        }
        Objects.requireNonNull(tick, "tick must not be null");
        if (tick.isNegative() || tick.isZero()) {
            throw new IllegalArgumentException("tick must be positive, got: " + tick);
        }
        this.maxConcurrent = maxConcurrent;
        this.tick = tick;
        this.slots = new Semaphore(maxConcurrent);
        this.defaultIntervals = new EnumMap<>(defaultPriorityIntervals());
        if (defaultIntervals != null) {
            this.defaultIntervals.putAll(defaultIntervals);
        }
    }

    /**
     * @return high = 10s, medium = 60s, low = 300s
     */
    public static Map<Priority, Duration> defaultPriorityIntervals() {
        Map<Priority, Duration> m = new EnumMap<>(Priority.class);
        m.put(Priority.HIGH, Duration.ofSeconds(10));
        m.put(Priority.MEDIUM, Duration.ofSeconds(60));
        m.put(Priority.LOW, Duration.ofSeconds(300));
        return m;
    }

    /**
     * @param interval requested interval; {@code null} is treated as the minimum
     * @return {@code interval} clamped into [{@link #MIN_INTERVAL},
     *         {@link #MAX_INTERVAL}]
     */
    public static Duration clampInterval(Duration interval) {
        if (interval == null || interval.compareTo(MIN_INTERVAL) < 0) {
            return MIN_INTERVAL;
        }
        return interval.compareTo(MAX_INTERVAL) > 0 ? MAX_INTERVAL : interval;
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Register a task using the default interval of its priority.
     */
    public void registerTask(String name, TaskHandler handler, Priority priority) {
        Objects.requireNonNull(priority, "Priority must not be null");
        registerTask(name, handler, defaultIntervals.get(priority), priority, null);
    }

    public void registerTask(String name, TaskHandler handler, Duration interval, Priority priority) {
        registerTask(name, handler, interval, priority, null);
    }

    /**
     * Register or replace a task.
     *
     * <p>
     * Replacing a task cancels the token of the previous registration; the new
     * body will not start until the previous one has returned. A new task is
     * ready on the next tick.
     * </p>
     *
     * @param name     unique name; must not be {@code null} or blank
     * @param handler  task body; must not be {@code null}
     * @param interval repeat interval, clamped into [0.1s, 3600s]
     * @param priority dispatch priority; {@code null} means medium
     * @param timeout  optional per-execution deadline carried by the token
     */
    public void registerTask(String name, TaskHandler handler, Duration interval, Priority priority,
            Duration timeout) {
        Objects.requireNonNull(name, "Task name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
        Objects.requireNonNull(handler, "TaskHandler must not be null");
        Priority effectivePriority = priority != null ? priority : Priority.MEDIUM;
        Duration clamped = clampInterval(interval);
        if (interval != null && !clamped.equals(interval)) {
            LOG.warn("Task '{}' interval {} clamped to {}", name, interval, clamped);
        }

        tasks.compute(name, (key, previous) -> {
            AtomicBoolean guard = previous != null ? previous.runningFlag() : new AtomicBoolean(false);
            if (previous != null) {
                previous.retire();
                LOG.info("Task '{}' replaced", key);
            }
            return new ScheduledTask(key, handler, clamped, effectivePriority, timeout,
                    sequence.getAndIncrement(), guard);
        });
        LOG.debug("Task '{}' registered: interval={}, priority={}", name, clamped, effectivePriority.value());
    }

    /**
     * @return {@code true} if the task existed
     */
    public boolean unregisterTask(String name) {
        if (name == null) {
            return false;
        }
        ScheduledTask removed = tasks.remove(name);
        if (removed == null) {
            return false;
        }
        removed.retire();
        LOG.info("Task '{}' unregistered", name);
        return true;
    }

    /**
     * Skip the task in readiness checks until resumed. Stats are untouched.
     *
     * @return {@code true} if the task exists
     */
    public boolean pauseTask(String name) {
        return setPaused(name, true);
    }

    /**
     * @return {@code true} if the task exists
     */
    public boolean resumeTask(String name) {
        return setPaused(name, false);
    }

    private boolean setPaused(String name, boolean paused) {
        ScheduledTask task = name == null ? null : tasks.get(name);
        if (task == null) {
            return false;
        }
        task.setPaused(paused);
        LOG.info("Task '{}' {}", name, paused ? "paused" : "resumed");
        return true;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the loop thread and worker pool. Calling it twice has no effect.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        workers = Executors.newFixedThreadPool(maxConcurrent, daemonThreads("scheduler-worker-"));
        loopThread = new Thread(this::loop, "scheduler-loop");
        loopThread.setDaemon(true);
        loopThread.start();
        LOG.info("Scheduler started: maxConcurrent={}, tick={}, tasks={}", maxConcurrent, tick, tasks.size());
    }

    /**
     * Stop scheduling, cancel every in-flight token and wait briefly for
     * workers to return.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        loopThread.interrupt();
        for (ScheduledTask task : tasks.values()) {
            task.cancelCurrent();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Scheduler workers still busy after {}; abandoning them", STOP_GRACE);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    private void loop() {
        while (running.get()) {
            try {
                dispatchReady(System.nanoTime());
                Thread.sleep(tick.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                LOG.error("Scheduler loop iteration failed - continuing", e);
            }
        }
    }

    void dispatchReady(long nowNanos) {
        for (ScheduledTask task : getReadyTasks(nowNanos)) {
            if (!slots.tryAcquire()) {
                return;
            }
            CancellationToken token = task.tryBegin(nowNanos);
            if (token == null) {
                slots.release();
                continue;
            }
            try {
                workers.execute(() -> execute(task, token));
            } catch (RejectedExecutionException e) {
                task.end();
                slots.release();
                LOG.debug("Task '{}' rejected during shutdown", task.getName());
                return;
            }
        }
    }

    /**
     * @return ready tasks in dispatch order
     */
    List<ScheduledTask> getReadyTasks(long nowNanos) {
        List<ScheduledTask> ready = new ArrayList<>();
        for (ScheduledTask task : tasks.values()) {
            if (task.isReady(nowNanos)) {
                ready.add(task);
            }
        }
        ready.sort(DISPATCH_ORDER);
        return ready;
    }

    private void execute(ScheduledTask task, CancellationToken token) {
        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();
        try {
            task.getHandler().run(token);
            task.recordSuccess(startedAt, elapsedMs(startNanos));
            if (token.isExpired()) {
                LOG.warn("Task '{}' overran its deadline", task.getName());
            }
        } catch (CancellationException e) {
            if (token.isCancelled()) {
                LOG.debug("Task '{}' stopped after cancellation", task.getName());
            } else {
                recordFailure(task, startedAt, startNanos, e);
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            recordFailure(task, startedAt, startNanos, e);
        } finally {
            task.end();
            slots.release();
        }
    }

    private void recordFailure(ScheduledTask task, Instant startedAt, long startNanos, Throwable e) {
        task.recordFailure(startedAt, elapsedMs(startNanos), e);
        LOG.warn("Task '{}' failed ({} consecutive)", task.getName(),
                task.statsSnapshot().getConsecutiveFailures(), e);
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    // ---------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------

    public int getTaskCount() {
        return tasks.size();
    }

    /**
     * @return snapshot of the task's stats, or empty if unknown
     */
    public Optional<TaskStats> getTaskStats(String name) {
        ScheduledTask task = name == null ? null : tasks.get(name);
        return task == null ? Optional.empty() : Optional.of(task.statsSnapshot());
    }

    public Optional<TaskState> getTaskState(String name) {
        ScheduledTask task = name == null ? null : tasks.get(name);
        return task == null ? Optional.empty() : Optional.of(task.state());
    }

    /**
     * @return {@code true} if the task exists and is paused, even while a
     *         previous execution is still running
     */
    public boolean isTaskPaused(String name) {
        ScheduledTask task = name == null ? null : tasks.get(name);
        return task != null && task.isPaused();
    }

    /**
     * @return effective (clamped) interval of the task, or empty if unknown
     */
    public Optional<Duration> getTaskInterval(String name) {
        ScheduledTask task = name == null ? null : tasks.get(name);
        return task == null ? Optional.empty() : Optional.of(task.getInterval());
    }

    /**
     * @return stats snapshot of every task in registration order
     */
    public Map<String, TaskStats> getAllTaskStats() {
        List<ScheduledTask> ordered = new ArrayList<>(tasks.values());
        ordered.sort(Comparator.comparingLong(ScheduledTask::getSequence));
        Map<String, TaskStats> out = new LinkedHashMap<>();
        for (ScheduledTask task : ordered) {
            out.put(task.getName(), task.statsSnapshot());
        }
        return Collections.unmodifiableMap(out);
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
