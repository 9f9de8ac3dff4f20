package org.nowstart.grammar.engine.gate;

import java.util.Optional;
import org.nowstart.grammar.data.property.GrammarProperties;
import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.EligibilityTier;
import org.nowstart.grammar.engine.core.Bar;
import org.nowstart.grammar.engine.core.IgnitionEvent;
import org.nowstart.grammar.engine.core.IndicatorSet;

/**
 * Stateless ignition filter. A bar fires when buyer/seller imbalance, channel extreme, body size and channel
 * range all line up; SHORT at the top of the channel, LONG at the bottom.
 */
public class EntryGate {

    private final GrammarProperties.Gate thresholds;

    public EntryGate(GrammarProperties.Gate thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("gate thresholds are required");
        }
        this.thresholds = thresholds;
    }

    public Optional<IgnitionEvent> evaluate(IndicatorSet indicators, Bar bar) {
        if (indicators == null || bar == null) {
            throw new IllegalArgumentException("indicators and bar are required");
        }

        boolean strongBody = Math.abs(indicators.bodyZScore()) >= thresholds.minBodyZScore();
        boolean wideChannel = indicators.channelRange() >= thresholds.minChannelRange();
        if (!strongBody || !wideChannel) {
            return Optional.empty();
        }

        if (indicators.directionalRatio() > thresholds.shortRatioAbove()
                && indicators.channelPct() > thresholds.shortChannelAbove()) {
            return Optional.of(ignition(Direction.SHORT, indicators, bar));
        }
        if (indicators.directionalRatio() < thresholds.longRatioBelow()
                && indicators.channelPct() < thresholds.longChannelBelow()) {
            return Optional.of(ignition(Direction.LONG, indicators, bar));
        }
        return Optional.empty();
    }

    private IgnitionEvent ignition(Direction direction, IndicatorSet indicators, Bar bar) {
        return new IgnitionEvent(bar.index(), direction, bar.close(), indicators, EligibilityTier.ELEVATED);
    }
}
