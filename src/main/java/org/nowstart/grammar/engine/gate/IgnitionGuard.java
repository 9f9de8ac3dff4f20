package org.nowstart.grammar.engine.gate;

import org.nowstart.grammar.data.type.EligibilityTier;
import org.nowstart.grammar.engine.core.IgnitionEvent;

/**
 * Tells a first ignition apart from a re-entry that fires inside the cooldown of the previous one.
 * Not thread-safe; one instance per instrument.
 */
public class IgnitionGuard {

    private final int cooldownBars;
    private Long lastIgnitionIndex;

    public IgnitionGuard(int cooldownBars) {
        if (cooldownBars < 0) {
            throw new IllegalArgumentException("cooldownBars must be non-negative");
        }
        this.cooldownBars = cooldownBars;
    }

    public IgnitionEvent classify(IgnitionEvent ignition) {
        EligibilityTier tier = lastIgnitionIndex != null && ignition.barIndex() - lastIgnitionIndex <= cooldownBars
                ? EligibilityTier.STANDARD
                : EligibilityTier.ELEVATED;
        lastIgnitionIndex = ignition.barIndex();
        return ignition.withTier(tier);
    }

    public void reset() {
        lastIgnitionIndex = null;
    }
}
