package com.matrixwatcher.core.detection;

import java.util.OptionalDouble;

/**
 * Bounded numeric history for one (source, parameter) pair.
 *
 * <p>
 * Holds at most {@code maxSize} values; appending to a full window evicts the
 * oldest value. Mean and sample standard deviation (Bessel's correction) are
 * computed in two passes over the window, O(maxSize) per call.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; {@link AnomalyDetector} synchronises on the window.
 * </p>
 *
 * @since 1.0.0
 */
public final class SlidingWindow {

    /** Fewest samples for which a standard deviation is defined. */
    public static final int MIN_SAMPLES = 2;

    private final double[] values;
    private int head;
    private int size;

    /**
     * @param maxSize capacity; must be &gt;= {@value #MIN_SAMPLES}
     * @throws IllegalArgumentException if {@code maxSize} is too small
     */
    public SlidingWindow(int maxSize) {
        if (maxSize < MIN_SAMPLES) {
            throw new IllegalArgumentException(
                    "maxSize must be >= " + MIN_SAMPLES + ", got: " + maxSize);
        }
        this.values = new double[maxSize];
    }

    public void add(double value) {
        if (size < values.length) {
            values[(head + size) % values.length] = value;
            size++;
        } else {
            values[head] = value;
            head = (head + 1) % values.length;
        }
    }

    public int size() {
        return size;
    }

    public int maxSize() {
        return values.length;
    }

    public boolean isFull() {
        return size == values.length;
    }

    /**
     * @return arithmetic mean, 0 for an empty window
     */
    public double mean() {
        if (size == 0) {
            return 0.0;
        }
        double sum = 0;
        for (int i = 0; i < size; i++) {
            sum += values[(head + i) % values.length];
        }
        return sum / size;
    }

    /**
     * @return sample standard deviation, 0 with fewer than two samples
     */
    public double std() {
        if (size < MIN_SAMPLES) {
            return 0.0;
        }
        double mean = mean();
        double sumSquaredDiff = 0;
        for (int i = 0; i < size; i++) {
            double diff = values[(head + i) % values.length] - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (size - 1));
    }

    /**
     * @param value candidate value, not inserted
     * @return {@code (value - mean) / std}, or empty when fewer than two samples
     *         are held or the deviation is zero
     */
    public OptionalDouble zScore(double value) {
        if (size < MIN_SAMPLES) {
            return OptionalDouble.empty();
        }
        double std = std();
        if (std == 0.0 || !Double.isFinite(std)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((value - mean()) / std);
    }

    /**
     * @return oldest-first copy of the values
     */
    public double[] toArray() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = values[(head + i) % values.length];
        }
        return out;
    }

    public void clear() {
        head = 0;
        size = 0;
    }

    @Override
    public String toString() {
        return "SlidingWindow{size=" + size + ", maxSize=" + values.length + '}';
    }
}
