/**
 * Per-parameter anomaly detection over sliding windows.
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.detection;
