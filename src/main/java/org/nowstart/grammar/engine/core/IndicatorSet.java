package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.Terminal;

public record IndicatorSet(
        double directionalRatio,
        double channelPct,
        double channelRange,
        double bodyZScore,
        double efficiencyRatio,
        double forceRatio,
        double delta,
        double depth,
        double depthSlope,
        double dcPre,
        Terminal terminal,
        double terminalTimeRatio,
        int sameColorRun,
        boolean burst
) {

    public IndicatorSet {
        if (terminal == null) {
            throw new IllegalArgumentException("terminal is required");
        }
    }
}
