/**
 * Condition to event pattern learning.
 *
 * <p>
 * {@link com.matrixwatcher.core.pattern.HistoricalPatternTracker} counts how
 * often each rule-detected event follows a cluster
 * {@link com.matrixwatcher.core.pattern.Condition}, with lead-time statistics
 * and Brier-score calibration. Storage goes through
 * {@link com.matrixwatcher.core.pattern.PatternRepository}.
 * </p>
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.pattern;
