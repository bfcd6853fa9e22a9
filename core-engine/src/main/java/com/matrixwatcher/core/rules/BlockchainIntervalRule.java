package com.matrixwatcher.core.rules;

import com.matrixwatcher.core.model.Payloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Fires when any network's latest block interval is a multiple of its
 * expected interval.
 *
 * <p>
 * Expects {@code networks: {name: {block_time_seconds, expected_block_time}}};
 * networks with a non-positive value are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class BlockchainIntervalRule extends AbstractEventRule {

    private static final Logger LOG = LoggerFactory.getLogger(BlockchainIntervalRule.class);

    private final double multiplier;

    public BlockchainIntervalRule(EventDefinition definition) {
        super(definition);
        this.multiplier = definition.getThreshold();
    }

    @Override
    public boolean matches(Map<String, Object> payload, RuleContext context) {
        if (!fromSource(payload, "blockchain")) {
            return false;
        }
        for (Map.Entry<String, Object> network : Payloads.map(payload, "networks").entrySet()) {
            if (!(network.getValue() instanceof Map<?, ?> stats)) {
                continue;
            }
            double blockTime = Payloads.number(stats.get("block_time_seconds")).orElse(0.0);
            double expected = Payloads.number(stats.get("expected_block_time")).orElse(0.0);
            if (expected > 0 && blockTime > 0 && blockTime >= expected * multiplier) {
                LOG.debug("Slow blocks on {}: {}s vs expected {}s", network.getKey(), blockTime, expected);
                return true;
            }
        }
        return false;
    }
}
