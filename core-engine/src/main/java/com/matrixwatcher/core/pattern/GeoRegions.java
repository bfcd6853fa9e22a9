package com.matrixwatcher.core.pattern;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Coarse seismic-region lookup by ordered bounding boxes.
 *
 * <p>
 * The table is scanned top to bottom and the first match wins; bounds are
 * exclusive. Coordinates outside every box belong to {@value #GLOBAL}.
 * </p>
 *
 * @since 1.0.0
 */
public final class GeoRegions {

    public static final String GLOBAL = "Global";

    static final int MIN_LOCATIONS = 3;
    static final int RECENT_SAMPLE = 100;
    static final double DOMINANCE_SHARE = 0.30;

    private static final List<Region> TABLE = List.of(
            new Region("Iceland", (lat, lon) -> between(lat, 63, 67) && between(lon, -25, -13)),
            new Region("South Atlantic", (lat, lon) -> between(lat, -61, -54) && between(lon, -30, -24)),
            new Region("Alaska", (lat, lon) -> lat > 50 && lon < -130),
            new Region("Japan", (lat, lon) -> between(lat, 30, 50) && between(lon, 125, 150)),
            new Region("Philippines", (lat, lon) -> between(lat, 4, 20) && between(lon, 118, 128)),
            new Region("Indonesia", (lat, lon) -> between(lat, -15, 10) && between(lon, 90, 145)),
            new Region("Pacific Islands", (lat, lon) -> between(lat, -60, -10) && lon > 160),
            new Region("Chile", (lat, lon) -> between(lat, -45, -10) && between(lon, -85, -60)),
            new Region("California", (lat, lon) -> between(lat, 30, 45) && between(lon, -130, -110)),
            new Region("Turkey/Greece", (lat, lon) -> between(lat, 32, 42) && between(lon, 25, 45)),
            new Region("Taiwan", (lat, lon) -> between(lat, 20, 28) && between(lon, 119, 123)),
            new Region("Antarctic", (lat, lon) -> lat < -60));

    private GeoRegions() {
        // utility class
    }

    /**
     * @return name of the first matching region, or {@value #GLOBAL}
     */
    public static String regionOf(double latitude, double longitude) {
        for (Region r : TABLE) {
            if (r.contains.test(latitude, longitude)) {
                return r.name;
            }
        }
        return GLOBAL;
    }

    public static String regionOf(GeoPoint point) {
        return regionOf(point.getLatitude(), point.getLongitude());
    }

    /**
     * Most frequent named region among the latest {@value #RECENT_SAMPLE}
     * locations.
     *
     * @return the region if at least {@value #MIN_LOCATIONS} locations exist,
     *         it covers at least 30% of the sample and is not {@value #GLOBAL}
     */
    public static Optional<String> dominantRegion(List<GeoPoint> locations) {
        if (locations == null || locations.size() < MIN_LOCATIONS) {
            return Optional.empty();
        }
        List<GeoPoint> sample = locations.subList(Math.max(0, locations.size() - RECENT_SAMPLE), locations.size());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GeoPoint p : sample) {
            counts.merge(regionOf(p), 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        if (best == null || GLOBAL.equals(best) || bestCount < DOMINANCE_SHARE * sample.size()) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    private static boolean between(double v, double low, double high) {
        return v > low && v < high;
    }

    private static final class Region {
        private final String name;
        private final BiPredicate<Double, Double> contains;

        private Region(String name, BiPredicate<Double, Double> contains) {
            this.name = name;
            this.contains = contains;
        }
    }
}
