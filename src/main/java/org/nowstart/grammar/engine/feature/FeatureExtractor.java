package org.nowstart.grammar.engine.feature;

import java.util.Arrays;
import java.util.List;
import org.nowstart.grammar.data.exception.InsufficientWindowException;
import org.nowstart.grammar.data.property.GrammarProperties;
import org.nowstart.grammar.data.type.Terminal;
import org.nowstart.grammar.engine.core.Bar;
import org.nowstart.grammar.engine.core.IndicatorSet;

/**
 * Pure indicator computation over a trailing bar window. The last bar of the window is the current bar.
 */
public class FeatureExtractor {

    private static final double FAST_TERMINAL_RATIO = 0.3;
    private static final double BURST_CHANNEL_HIGH = 90.0;
    private static final double BURST_CHANNEL_LOW = 10.0;
    private static final double BURST_PERCENTILE = 0.9;

    private final int channelLookback;
    private final int depthSlopeBars;
    private final int erLookback;
    private final int forceLookback;
    private final int dcLookback;
    private final int minimumBars;

    public FeatureExtractor(GrammarProperties properties) {
        this.channelLookback = properties.channelLookback();
        this.depthSlopeBars = properties.depthSlopeBars();
        this.erLookback = properties.erLookback();
        this.forceLookback = properties.forceLookback();
        this.dcLookback = properties.dcLookback();
        this.minimumBars = properties.minimumWindow();
    }

    public int minimumBars() {
        return minimumBars;
    }

    public IndicatorSet extract(List<Bar> window) {
        if (window == null) {
            throw new IllegalArgumentException("window is required");
        }
        if (window.size() < minimumBars) {
            throw new InsufficientWindowException(window.size(), minimumBars);
        }

        int last = window.size() - 1;
        Bar current = window.get(last);
        double ratio = directionalRatio(current);
        double channelRange = channelRange(window, last);
        double channelPct = channelPct(window, last);
        double depth = depth(window, last);
        double depthSlope = (depth - depth(window, last - depthSlopeBars)) / depthSlopeBars;
        double terminalTimeRatio = terminalTimeRatio(window, last);

        return new IndicatorSet(
                ratio,
                channelPct,
                channelRange,
                bodyZScore(window, last),
                efficiencyRatio(window, last),
                forceRatio(window, last),
                current.delta(),
                depth,
                depthSlope,
                dcPre(window, last),
                terminalTimeRatio < FAST_TERMINAL_RATIO ? Terminal.FAST : Terminal.SLOW,
                terminalTimeRatio,
                sameColorRun(window, last),
                isBurst(window, last, ratio, channelPct)
        );
    }

    static double directionalRatio(Bar bar) {
        double buyer = Math.max(bar.close() - bar.low(), 0.01);
        double seller = Math.max(bar.high() - bar.close(), 0.01);
        return buyer / seller;
    }

    private double channelRange(List<Bar> window, int end) {
        int start = end - channelLookback + 1;
        return highestHigh(window, start, end) - lowestLow(window, start, end);
    }

    private double channelPct(List<Bar> window, int end) {
        int start = end - channelLookback + 1;
        double lowestLow = lowestLow(window, start, end);
        double range = highestHigh(window, start, end) - lowestLow;
        if (range < 1.0) {
            return 50.0;
        }
        return (window.get(end).close() - lowestLow) / range * 100.0;
    }

    private double depth(List<Bar> window, int end) {
        int start = end - channelLookback + 1;
        double highestHigh = highestHigh(window, start, end);
        double range = highestHigh - lowestLow(window, start, end);
        if (range < 0.01) {
            return 0.5;
        }
        return (highestHigh - window.get(end).close()) / range;
    }

    private double bodyZScore(List<Bar> window, int end) {
        double[] bodies = new double[channelLookback];
        for (int i = 0; i < channelLookback; i++) {
            bodies[i] = window.get(end - channelLookback + 1 + i).body();
        }
        double mean = mean(bodies);
        double std = populationStd(bodies, mean);
        if (std < 1e-9) {
            return 0.0;
        }
        return (window.get(end).body() - mean) / std;
    }

    private double efficiencyRatio(List<Bar> window, int end) {
        int start = end - erLookback + 1;
        double change = Math.abs(window.get(end).close() - window.get(start).close());
        double movement = 0.0;
        for (int i = start + 1; i <= end; i++) {
            movement += Math.abs(window.get(i).close() - window.get(i - 1).close());
        }
        if (movement < 0.01) {
            return 1.0;
        }
        return Math.min(1.0, change / movement);
    }

    private double forceRatio(List<Bar> window, int end) {
        double buyers = 0.0;
        double sellers = 0.0;
        for (int i = end - forceLookback + 1; i <= end; i++) {
            Bar bar = window.get(i);
            buyers += bar.close() - bar.low();
            sellers += bar.high() - bar.close();
        }
        if (sellers < 0.1) {
            return 10.0;
        }
        return buyers / sellers;
    }

    private double dcPre(List<Bar> window, int end) {
        int start = end - dcLookback + 1;
        double[] closes = new double[dcLookback];
        double rangeSum = 0.0;
        for (int i = start; i <= end; i++) {
            closes[i - start] = window.get(i).close();
            rangeSum += window.get(i).range();
        }
        double meanRange = rangeSum / dcLookback;
        if (meanRange < 0.01 || dcLookback < 2) {
            return 1.0;
        }
        return sampleStd(closes, mean(closes)) / meanRange;
    }

    private double terminalTimeRatio(List<Bar> window, int end) {
        int start = end - channelLookback + 1;
        double anchor = window.get(start).close();
        int extremeOffset = 0;
        double largest = 0.0;
        for (int i = start; i <= end; i++) {
            double excursion = Math.abs(window.get(i).close() - anchor);
            if (excursion > largest) {
                largest = excursion;
                extremeOffset = i - start;
            }
        }
        return (double) extremeOffset / channelLookback;
    }

    private int sameColorRun(List<Bar> window, int end) {
        int color = window.get(end).color();
        if (color == 0) {
            return 0;
        }
        int run = 0;
        for (int i = end; i >= 0 && window.get(i).color() == color; i--) {
            run++;
        }
        return run;
    }

    private boolean isBurst(List<Bar> window, int end, double ratio, double channelPct) {
        if (channelPct <= BURST_CHANNEL_HIGH && channelPct >= BURST_CHANNEL_LOW) {
            return false;
        }
        if (end == 0) {
            return false;
        }
        double[] deviations = new double[end];
        for (int i = 0; i < end; i++) {
            deviations[i] = Math.abs(directionalRatio(window.get(i)) - 1.0);
        }
        Arrays.sort(deviations);
        int rank = (int) Math.ceil(BURST_PERCENTILE * deviations.length) - 1;
        double threshold = deviations[Math.max(rank, 0)];
        return Math.abs(ratio - 1.0) > threshold;
    }

    private static double highestHigh(List<Bar> window, int start, int end) {
        double value = Double.NEGATIVE_INFINITY;
        for (int i = start; i <= end; i++) {
            value = Math.max(value, window.get(i).high());
        }
        return value;
    }

    private static double lowestLow(List<Bar> window, int start, int end) {
        double value = Double.POSITIVE_INFINITY;
        for (int i = start; i <= end; i++) {
            value = Math.min(value, window.get(i).low());
        }
        return value;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    private static double populationStd(double[] values, double mean) {
        double sum = 0.0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return Math.sqrt(sum / values.length);
    }

    private static double sampleStd(double[] values, double mean) {
        double sum = 0.0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return Math.sqrt(sum / (values.length - 1));
    }
}
