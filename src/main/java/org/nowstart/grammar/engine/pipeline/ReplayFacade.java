package org.nowstart.grammar.engine.pipeline;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.grammar.data.property.GrammarProperties;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.engine.certify.FastRetestCorroboration;
import org.nowstart.grammar.engine.core.Bar;
import org.nowstart.grammar.engine.core.BarDecision;

/**
 * Static bridge for offline callers that hold bars as primitive arrays. Every call replays on a fresh
 * pipeline, so results depend only on the arrays and the configuration.
 */
public final class ReplayFacade {

    private static final String REPLAY_INSTRUMENT = "REPLAY";

    private ReplayFacade() {
    }

    public static List<BarDecision> replay(
            long[] timestampEpochMillis,
            double[] open,
            double[] high,
            double[] low,
            double[] close,
            double[] delta,
            GrammarProperties properties
    ) {
        List<Bar> bars = toBars(timestampEpochMillis, open, high, low, close, delta);
        GrammarProperties resolved = properties == null ? GrammarProperties.defaults() : properties;
        InstrumentPipeline pipeline = new InstrumentPipelineFactory(
                resolved,
                LockedDoctrine.V7_4,
                new FastRetestCorroboration(LockedDoctrine.V7_4),
                Clock.systemUTC()
        ).create(REPLAY_INSTRUMENT);

        List<BarDecision> decisions = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            decisions.add(pipeline.onBar(bar));
        }
        return decisions;
    }

    public static List<BarDecision> replay(
            long[] timestampEpochMillis,
            double[] open,
            double[] high,
            double[] low,
            double[] close
    ) {
        return replay(timestampEpochMillis, open, high, low, close, null, null);
    }

    private static List<Bar> toBars(
            long[] timestampEpochMillis,
            double[] open,
            double[] high,
            double[] low,
            double[] close,
            double[] delta
    ) {
        if (timestampEpochMillis == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("timestamp/high/low/close arrays are required");
        }

        int n = close.length;
        if (n == 0) {
            return List.of();
        }

        if (timestampEpochMillis.length != n || high.length != n || low.length != n) {
            throw new IllegalArgumentException("all required arrays must have identical lengths");
        }

        double[] resolvedOpen = open == null ? close : open;
        double[] resolvedDelta = delta == null ? new double[n] : delta;
        if (resolvedOpen.length != n || resolvedDelta.length != n) {
            throw new IllegalArgumentException("open and delta arrays must match close length");
        }

        List<Bar> bars = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            bars.add(new Bar(
                    timestampEpochMillis[i],
                    i,
                    resolvedOpen[i],
                    high[i],
                    low[i],
                    close[i],
                    resolvedDelta[i]
            ));
        }
        return bars;
    }
}
