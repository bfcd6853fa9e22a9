package com.matrixwatcher.core.pattern;

import java.time.Duration;

/**
 * Tuning values for {@link HistoricalPatternTracker}.
 *
 * <p>
 * Built with {@link #builder()}; {@link Builder#build()} validates ranges.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrackerSettings {

    private final int lookbackHours;
    private final int recentConditionCapacity;
    private final int priceHistoryCapacity;
    private final int minObservations;
    private final int temporalMinObservations;
    private final double minLeadTimeHours;
    private final double earthquakeMaxWindowHours;
    private final int maxEventLocations;
    private final int calibrationMinObservations;
    private final double wellCalibratedBrier;

    private TrackerSettings(Builder b) {
        this.lookbackHours = b.lookbackHours;
        this.recentConditionCapacity = b.recentConditionCapacity;
        this.priceHistoryCapacity = b.priceHistoryCapacity;
        this.minObservations = b.minObservations;
        this.temporalMinObservations = b.temporalMinObservations;
        this.minLeadTimeHours = b.minLeadTimeHours;
        this.earthquakeMaxWindowHours = b.earthquakeMaxWindowHours;
        this.maxEventLocations = b.maxEventLocations;
        this.calibrationMinObservations = b.calibrationMinObservations;
        this.wellCalibratedBrier = b.wellCalibratedBrier;
    }

    public static TrackerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getLookbackHours() {
        return lookbackHours;
    }

    public Duration getLookback() {
        return Duration.ofHours(lookbackHours);
    }

    public int getRecentConditionCapacity() {
        return recentConditionCapacity;
    }

    public int getPriceHistoryCapacity() {
        return priceHistoryCapacity;
    }

    public int getMinObservations() {
        return minObservations;
    }

    public int getTemporalMinObservations() {
        return temporalMinObservations;
    }

    public double getMinLeadTimeHours() {
        return minLeadTimeHours;
    }

    public double getEarthquakeMaxWindowHours() {
        return earthquakeMaxWindowHours;
    }

    public int getMaxEventLocations() {
        return maxEventLocations;
    }

    public int getCalibrationMinObservations() {
        return calibrationMinObservations;
    }

    public double getWellCalibratedBrier() {
        return wellCalibratedBrier;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private int lookbackHours = 72;
        private int recentConditionCapacity = 5_000;
        private int priceHistoryCapacity = 10_000;
        private int minObservations = 5;
        private int temporalMinObservations = 50;
        private double minLeadTimeHours = 0.5;
        private double earthquakeMaxWindowHours = 12.0;
        private int maxEventLocations = 1_000;
        private int calibrationMinObservations = 5;
        private double wellCalibratedBrier = 0.1;

        public Builder lookbackHours(int v) {
            this.lookbackHours = v;
            return this;
        }

        public Builder recentConditionCapacity(int v) {
            this.recentConditionCapacity = v;
            return this;
        }

        public Builder priceHistoryCapacity(int v) {
            this.priceHistoryCapacity = v;
            return this;
        }

        public Builder minObservations(int v) {
            this.minObservations = v;
            return this;
        }

        public Builder temporalMinObservations(int v) {
            this.temporalMinObservations = v;
            return this;
        }

        public Builder minLeadTimeHours(double v) {
            this.minLeadTimeHours = v;
            return this;
        }

        public Builder earthquakeMaxWindowHours(double v) {
            this.earthquakeMaxWindowHours = v;
            return this;
        }

        public Builder maxEventLocations(int v) {
            this.maxEventLocations = v;
            return this;
        }

        public Builder calibrationMinObservations(int v) {
            this.calibrationMinObservations = v;
            return this;
        }

        public Builder wellCalibratedBrier(double v) {
            this.wellCalibratedBrier = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public TrackerSettings build() {
            requirePositive(lookbackHours, "lookbackHours");
            requirePositive(recentConditionCapacity, "recentConditionCapacity");
            requirePositive(priceHistoryCapacity, "priceHistoryCapacity");
            requirePositive(maxEventLocations, "maxEventLocations");
            if (minObservations < 0) {
                throw new IllegalArgumentException("minObservations must be >= 0, got: " + minObservations);
            }
            if (temporalMinObservations < 0) {
                throw new IllegalArgumentException(
                        "temporalMinObservations must be >= 0, got: " + temporalMinObservations);
            }
            if (minLeadTimeHours < 0) {
                throw new IllegalArgumentException("minLeadTimeHours must be >= 0, got: " + minLeadTimeHours);
            }
            if (earthquakeMaxWindowHours <= 0) {
                throw new IllegalArgumentException(
                        "earthquakeMaxWindowHours must be > 0, got: " + earthquakeMaxWindowHours);
            }
            if (calibrationMinObservations < 0) {
                throw new IllegalArgumentException(
                        "calibrationMinObservations must be >= 0, got: " + calibrationMinObservations);
            }
            return new TrackerSettings(this);
        }

        private static void requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "TrackerSettings{" +
                "lookbackHours=" + lookbackHours +
                ", recentConditionCapacity=" + recentConditionCapacity +
                ", minObservations=" + minObservations +
                ", temporalMinObservations=" + temporalMinObservations +
                ", minLeadTimeHours=" + minLeadTimeHours +
                '}';
    }
}
