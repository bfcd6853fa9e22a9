package com.matrixwatcher.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lenient accessors for loosely-typed payload maps.
 *
 * <p>
 * Every method returns an empty result rather than throwing when a value is
 * missing or has an unexpected type.
 * </p>
 *
 * @since 1.0.0
 */
public final class Payloads {

    private Payloads() {
        // utility class
    }

    /**
     * Coerce a raw value to a finite {@code double}.
     *
     * @param raw a {@link Number} or a numeric string
     * @return the value, or empty if absent, unparsable or non-finite
     */
    public static Optional<Double> number(Object raw) {
        double v;
        if (raw instanceof Number n) {
            v = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                v = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(v) ? Optional.of(v) : Optional.empty();
    }

    public static Optional<Double> number(Map<String, ?> payload, String key) {
        return payload == null ? Optional.empty() : number(payload.get(key));
    }

    /**
     * Look up a number by literal key, falling back to a dotted path through
     * nested maps ({@code "btcusdt.price_change_24h_percent"}).
     */
    public static Optional<Double> numberAtPath(Map<String, ?> payload, String path) {
        Optional<Double> direct = number(payload, path);
        if (direct.isPresent() || payload == null) {
            return direct;
        }
        Object current = payload;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> m)) {
                return Optional.empty();
            }
            current = m.get(part);
        }
        return number(current);
    }

    public static Optional<String> string(Map<String, ?> payload, String key) {
        if (payload == null) {
            return Optional.empty();
        }
        Object raw = payload.get(key);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * @return the nested map under {@code key}, or an empty map
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, ?> payload, String key) {
        if (payload != null && payload.get(key) instanceof Map<?, ?> m) {
            return (Map<String, Object>) m;
        }
        return Collections.emptyMap();
    }

    /**
     * @return the list under {@code key}, or an empty list
     */
    public static List<?> list(Map<String, ?> payload, String key) {
        if (payload != null && payload.get(key) instanceof List<?> l) {
            return l;
        }
        return Collections.emptyList();
    }
}
