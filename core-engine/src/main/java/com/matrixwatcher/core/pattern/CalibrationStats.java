package com.matrixwatcher.core.pattern;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Brier-score summary over patterns with enough observations.
 *
 * @since 1.0.0
 */
public final class CalibrationStats {

    private final int totalPatterns;
    private final double avgBrierScore;
    private final double wellCalibratedPercent;

    public CalibrationStats(int totalPatterns, double avgBrierScore, double wellCalibratedPercent) {
        this.totalPatterns = totalPatterns;
        this.avgBrierScore = avgBrierScore;
        this.wellCalibratedPercent = wellCalibratedPercent;
    }

    public int getTotalPatterns() {
        return totalPatterns;
    }

    public double getAvgBrierScore() {
        return avgBrierScore;
    }

    /**
     * @return share of patterns with a Brier score below 0.1, 0-100
     */
    public double getWellCalibratedPercent() {
        return wellCalibratedPercent;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total_patterns", totalPatterns);
        m.put("avg_brier_score", avgBrierScore);
        m.put("well_calibrated_percent", wellCalibratedPercent);
        return m;
    }

    @Override
    public String toString() {
        return "CalibrationStats{patterns=" + totalPatterns + ", brier=" + avgBrierScore
                + ", wellCalibrated=" + wellCalibratedPercent + "%}";
    }
}
