package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.EligibilityTier;

/**
 * Entry candidate emitted by the gate on a closed bar. {@code price} is the bar close used as entry reference.
 */
public record IgnitionEvent(
        long barIndex,
        Direction direction,
        double price,
        IndicatorSet indicators,
        EligibilityTier tier
) {

    public IgnitionEvent {
        if (direction == null || indicators == null) {
            throw new IllegalArgumentException("direction and indicators are required");
        }
        if (tier == null) {
            tier = EligibilityTier.ELEVATED;
        }
    }

    public IgnitionEvent withTier(EligibilityTier resolvedTier) {
        return new IgnitionEvent(barIndex, direction, price, indicators, resolvedTier);
    }
}
