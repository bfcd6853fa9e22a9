/**
 * Domain model shared by every Matrix Watcher component.
 *
 * <p>
 * {@link com.matrixwatcher.core.model.SensorReading} is what collectors
 * produce, {@link com.matrixwatcher.core.model.Event} is what travels on the
 * bus, and {@link com.matrixwatcher.core.model.AnomalyRecord} /
 * {@link com.matrixwatcher.core.model.AnomalyEvent} carry flagged deviations
 * from the detector to the cluster stage.
 * </p>
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.model;
