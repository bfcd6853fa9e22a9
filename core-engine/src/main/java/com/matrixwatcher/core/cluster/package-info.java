/**
 * Temporal clustering of anomalies across sensors.
 *
 * <p>
 * {@link com.matrixwatcher.core.cluster.ClusterAnalyzer} works on a complete
 * table; {@link com.matrixwatcher.core.cluster.ClusterDetector} updates one
 * open cluster as anomalies stream in. Both use the same proximity graph and
 * {@link com.matrixwatcher.core.cluster.LevelPolicy}.
 * </p>
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.cluster;
