package org.nowstart.grammar.engine.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.nowstart.grammar.data.type.Terminal;

/**
 * Per-bar observation record. {@code islandId} is only present on FAST terminals.
 */
public record DecisionRecord(
        long ts,
        long idx,
        double depth,
        @JsonProperty("depth_slope") double depthSlope,
        Terminal terminal,
        @JsonProperty("island_id") @JsonInclude(JsonInclude.Include.NON_NULL) String islandId,
        @JsonProperty("burst_event") int burstEvent,
        @JsonProperty("dc_pre") double dcPre,
        double er,
        double delta,
        double channel
) {

    public static DecisionRecord of(Bar bar, IndicatorSet indicators) {
        String islandId = indicators.terminal() == Terminal.FAST ? islandKey(indicators) : null;
        return new DecisionRecord(
                bar.timestamp(),
                bar.index(),
                indicators.depth(),
                indicators.depthSlope(),
                indicators.terminal(),
                islandId,
                indicators.burst() ? 1 : 0,
                indicators.dcPre(),
                indicators.efficiencyRatio(),
                indicators.delta(),
                indicators.channelPct()
        );
    }

    static String islandKey(IndicatorSet indicators) {
        String depthBin = indicators.depth() > 0.5 ? "High" : "Low";
        String dcBin = indicators.dcPre() < 0.8 ? "Comp" : "Loose";
        String deltaBin = Math.abs(indicators.delta()) > 0.5 ? "Large" : "Small";
        String forceBin;
        if (indicators.forceRatio() > 1.3) {
            forceBin = "Strong";
        } else if (indicators.forceRatio() < 0.7) {
            forceBin = "Weak";
        } else {
            forceBin = "Mid";
        }
        String erBin = indicators.efficiencyRatio() > 0.6 ? "High" : "Low";
        String runBin = indicators.sameColorRun() >= 3 ? "High" : "Low";
        String channelBin;
        if (indicators.channelPct() > 80.0) {
            channelBin = "Top";
        } else if (indicators.channelPct() < 20.0) {
            channelBin = "Bot";
        } else {
            channelBin = "Mid";
        }
        return String.join("_", depthBin, dcBin, deltaBin, forceBin, erBin, runBin, channelBin);
    }
}
