package org.nowstart.grammar.engine.core;

import java.time.Duration;

/**
 * Modelled execution cost of the next fill. Supplied by the execution side, never inferred from bars.
 */
public record ExecutionFriction(double slippage, double spread, Duration latency) {

    public static final ExecutionFriction NONE = new ExecutionFriction(0.0, 0.0, Duration.ZERO);

    public ExecutionFriction {
        if (!(slippage >= 0.0) || !(spread >= 0.0)) {
            throw new IllegalArgumentException("slippage and spread must be non-negative");
        }
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("latency must be non-negative");
        }
    }
}
