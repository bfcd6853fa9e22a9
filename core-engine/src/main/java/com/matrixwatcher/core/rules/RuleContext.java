package com.matrixwatcher.core.rules;

import java.time.Instant;
import java.util.Objects;

/**
 * Inputs shared by all rules during one evaluation pass.
 *
 * @since 1.0.0
 */
public final class RuleContext {

    private final Instant now;
    private final PriceHistory priceHistory;

    public RuleContext(Instant now, PriceHistory priceHistory) {
        this.now = Objects.requireNonNull(now, "now must not be null");
        this.priceHistory = Objects.requireNonNull(priceHistory, "PriceHistory must not be null");
    }

    public Instant getNow() {
        return now;
    }

    public PriceHistory getPriceHistory() {
        return priceHistory;
    }
}
