package com.matrixwatcher.core.pattern;

/**
 * Six-hour UTC time-of-day bucket used by temporal pattern keys.
 *
 * @since 1.0.0
 */
public enum TimeBucket {

    NIGHT("night", "night (00-06 UTC)"),
    MORNING("morning", "morning (06-12 UTC)"),
    AFTERNOON("afternoon", "afternoon (12-18 UTC)"),
    EVENING("evening", "evening (18-24 UTC)");

    private final String key;
    private final String label;

    TimeBucket(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /**
     * @param hourOfDay 0-23 UTC
     */
    public static TimeBucket fromHour(int hourOfDay) {
        if (hourOfDay < 6) {
            return NIGHT;
        }
        if (hourOfDay < 12) {
            return MORNING;
        }
        return hourOfDay < 18 ? AFTERNOON : EVENING;
    }

    /**
     * @return fragment used inside pattern keys
     */
    public String key() {
        return key;
    }

    /**
     * @return human-readable label
     */
    public String label() {
        return label;
    }
}
