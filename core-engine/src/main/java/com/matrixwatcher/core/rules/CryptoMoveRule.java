package com.matrixwatcher.core.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Detects a percentage price move of one asset over a fixed horizon.
 *
 * <p>
 * The reference price is the most recent sample at or before
 * {@code now - hours}; without one the rule cannot fire.
 * </p>
 *
 * @since 1.0.0
 */
public class CryptoMoveRule extends AbstractEventRule {

    private static final Logger LOG = LoggerFactory.getLogger(CryptoMoveRule.class);

    private final String asset;
    private final boolean pump;
    private final Duration horizon;
    private final double thresholdPercent;

    public CryptoMoveRule(EventDefinition definition) {
        super(definition);
        this.asset = Objects.requireNonNull(definition.getAsset(),
                "Asset must not be null for crypto rule '" + definition.getName() + "'");
        this.pump = "pump".equals(definition.getDirection());
        this.horizon = Duration.ofHours(definition.getHours());
        this.thresholdPercent = definition.getThreshold();
    }

    @Override
    public boolean matches(Map<String, Object> payload, RuleContext context) {
        if (!fromSource(payload, "crypto")) {
            return false;
        }
        OptionalDouble current = PriceHistory.currentPrice(payload, asset);
        if (current.isEmpty()) {
            return false;
        }
        OptionalDouble old = context.getPriceHistory().priceAtOrBefore(asset, context.getNow().minus(horizon));
        if (old.isEmpty() || old.getAsDouble() <= 0) {
            return false;
        }
        double changePercent = (current.getAsDouble() - old.getAsDouble()) / old.getAsDouble() * 100.0;
        boolean fired = pump ? changePercent >= thresholdPercent : changePercent <= -thresholdPercent;
        if (fired) {
            LOG.debug("{} {} {}: {}% over {}", getEventType(), asset, pump ? "pump" : "dump",
                    String.format("%.2f", changePercent), horizon);
        }
        return fired;
    }

    public String getAsset() {
        return asset;
    }

    public boolean isPump() {
        return pump;
    }

    public Duration getHorizon() {
        return horizon;
    }
}
