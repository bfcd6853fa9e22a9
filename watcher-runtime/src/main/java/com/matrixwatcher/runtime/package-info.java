/**
 * Process wiring for Matrix Watcher.
 *
 * <p>
 * This package loads configuration, schedules sensor polling and
 * housekeeping around the analysis core, stores learned patterns as JSON and
 * serves health endpoints.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.matrixwatcher.runtime.MatrixWatcher} - main entry
 * point</li>
 * <li>{@link com.matrixwatcher.runtime.RuntimeConfig} - environment-driven
 * configuration</li>
 * <li>{@link com.matrixwatcher.runtime.SettingsLoader} - YAML analysis
 * settings</li>
 * <li>{@link com.matrixwatcher.runtime.JsonPatternRepository} - pattern
 * storage</li>
 * <li>{@link com.matrixwatcher.runtime.TaskHealthMonitor} - pauses failing
 * tasks</li>
 * <li>{@link com.matrixwatcher.runtime.HealthServer} - HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.matrixwatcher.runtime;
