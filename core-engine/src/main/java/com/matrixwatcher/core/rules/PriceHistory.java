package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;
import com.matrixwatcher.core.util.RingBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Rolling price samples per crypto asset.
 *
 * <p>
 * Each asset keeps at most {@code capacity} samples in arrival order.
 * Crypto payloads carry a {@code pairs} list of {@code {symbol, price}}
 * entries; the price of asset {@code X} is taken from symbol {@code XUSDT}.
 * </p>
 *
 * <p>
 * {@link #exportSince(Instant)} and {@link #restore(Map, Instant)} move the
 * samples through plain maps of {@value #TIMESTAMP} (epoch seconds) and
 * {@value #PRICE}, so the history survives a restart.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All methods are {@code synchronized}.
 * </p>
 *
 * @since 1.0.0
 */
public class PriceHistory {

    private static final Logger LOG = LoggerFactory.getLogger(PriceHistory.class);

    public static final int DEFAULT_CAPACITY = 10_000;
    public static final String TIMESTAMP = "timestamp";
    public static final String PRICE = "price";
    static final String QUOTE_SUFFIX = "USDT";

    private final int capacity;
    private final Map<String, RingBuffer<Sample>> samples = new HashMap<>();

    public PriceHistory() {
        this(DEFAULT_CAPACITY);
    }

    public PriceHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Current price of {@code asset} in a crypto payload.
     *
     * @return positive price, or empty if absent
     */
    public static OptionalDouble currentPrice(Map<String, Object> payload, String asset) {
        String symbol = asset.toUpperCase(Locale.ROOT) + QUOTE_SUFFIX;
        for (Object entry : Payloads.list(payload, "pairs")) {
            if (entry instanceof Map<?, ?> pair && symbol.equals(String.valueOf(pair.get("symbol")))) {
                double price = Payloads.number(pair.get("price")).orElse(0.0);
                return price > 0 ? OptionalDouble.of(price) : OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Record the current price of every tracked asset found in the payload.
     *
     * @return number of samples recorded
     */
    public synchronized int recordFrom(Map<String, Object> payload, Instant now, Collection<String> assets) {
        int recorded = 0;
        for (String asset : assets) {
            OptionalDouble price = currentPrice(payload, asset);
            if (price.isPresent()) {
                record(asset, now, price.getAsDouble());
                recorded++;
            }
        }
        return recorded;
    }

    public synchronized void record(String asset, Instant timestamp, double price) {
        Objects.requireNonNull(asset, "asset must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        samples.computeIfAbsent(key(asset), k -> new RingBuffer<>(capacity))
                .add(new Sample(timestamp, price));
        LOG.trace("Price sample {}={} at {}", asset, price, timestamp);
    }

    /**
     * @return price of the most recent sample taken at or before
     *         {@code target}, or empty if none
     */
    public synchronized OptionalDouble priceAtOrBefore(String asset, Instant target) {
        RingBuffer<Sample> buffer = samples.get(key(asset));
        if (buffer == null) {
            return OptionalDouble.empty();
        }
        OptionalDouble found = OptionalDouble.empty();
        for (Sample s : buffer) {
            if (s.timestamp.isAfter(target)) {
                break;
            }
            found = OptionalDouble.of(s.price);
        }
        return found;
    }

    /**
     * @return asset to samples taken after {@code cutoff}, oldest first
     */
    public synchronized Map<String, List<Map<String, Object>>> exportSince(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Map<String, List<Map<String, Object>>> out = new TreeMap<>();
        for (Map.Entry<String, RingBuffer<Sample>> entry : samples.entrySet()) {
            List<Map<String, Object>> kept = new ArrayList<>();
            for (Sample s : entry.getValue()) {
                if (s.timestamp.isAfter(cutoff)) {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put(TIMESTAMP, s.timestamp.toEpochMilli() / 1000.0);
                    m.put(PRICE, s.price);
                    kept.add(m);
                }
            }
            if (!kept.isEmpty()) {
                out.put(entry.getKey(), kept);
            }
        }
        return out;
    }

    /**
     * Append exported samples taken after {@code cutoff}. Entries without a
     * numeric timestamp or with a non-positive price are skipped.
     *
     * @return number of samples restored
     */
    public synchronized int restore(Map<String, ? extends List<? extends Map<String, ?>>> exported, Instant cutoff) {
        Objects.requireNonNull(exported, "exported samples must not be null");
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        int restored = 0;
        for (Map.Entry<String, ? extends List<? extends Map<String, ?>>> entry : exported.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            for (Map<String, ?> m : entry.getValue()) {
                Optional<Double> seconds = Payloads.number(m, TIMESTAMP);
                double price = Payloads.number(m, PRICE).orElse(0.0);
                if (seconds.isEmpty() || price <= 0) {
                    continue;
                }
                Instant timestamp = Instant.ofEpochMilli(Math.round(seconds.get() * 1000.0));
                if (timestamp.isAfter(cutoff)) {
                    record(entry.getKey(), timestamp, price);
                    restored++;
                }
            }
        }
        LOG.debug("Restored {} price sample(s)", restored);
        return restored;
    }

    public synchronized int size(String asset) {
        RingBuffer<Sample> buffer = samples.get(key(asset));
        return buffer == null ? 0 : buffer.size();
    }

    public synchronized void clear() {
        samples.clear();
    }

    private static String key(String asset) {
        return asset.toUpperCase(Locale.ROOT);
    }

    private static final class Sample {
        private final Instant timestamp;
        private final double price;

        private Sample(Instant timestamp, double price) {
            this.timestamp = timestamp;
            this.price = price;
        }
    }
}
