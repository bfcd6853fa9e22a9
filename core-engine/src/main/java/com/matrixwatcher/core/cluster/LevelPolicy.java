package com.matrixwatcher.core.cluster;

/**
 * Maps a cluster's source diversity and size to a level in [1, 5].
 *
 * <p>
 * The base level is the number of distinct sources, capped at 5. A cluster
 * with at least two sources gains one level when it holds at least
 * {@code densityFactor} anomalies per source. The function is total,
 * deterministic and non-decreasing in both arguments.
 * </p>
 *
 * @since 1.0.0
 */
public final class LevelPolicy {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 5;
    public static final int DEFAULT_DENSITY_FACTOR = 3;

    private final int densityFactor;

    public LevelPolicy() {
        this(DEFAULT_DENSITY_FACTOR);
    }

    /**
     * @param densityFactor anomalies per source needed for the bonus level;
     *                      must be &gt;= 1
     */
    public LevelPolicy(int densityFactor) {
        if (densityFactor < 1) {
            throw new IllegalArgumentException("densityFactor must be >= 1, got: " + densityFactor);
        }
        this.densityFactor = densityFactor;
    }

    /**
     * @param uniqueSources distinct sources in the cluster
     * @param anomalyCount  members in the cluster
     * @return level in [{@value #MIN_LEVEL}, {@value #MAX_LEVEL}]
     */
    public int levelFor(int uniqueSources, int anomalyCount) {
        int level = Math.max(MIN_LEVEL, Math.min(uniqueSources, MAX_LEVEL));
        if (uniqueSources >= 2 && anomalyCount >= (long) densityFactor * uniqueSources) {
            level++;
        }
        return Math.min(level, MAX_LEVEL);
    }

    public int getDensityFactor() {
        return densityFactor;
    }

    /**
     * Display name used by notifiers.
     */
    public static String levelName(int level) {
        return switch (level) {
            case 1 -> "Single Anomaly";
            case 2 -> "Correlation";
            case 3 -> "Multiple Correlation";
            case 4 -> "Strong Correlation";
            default -> level >= 5 ? "Critical Anomaly" : "Anomaly";
        };
    }
}
