package org.nowstart.grammar.engine.core;

/**
 * One closed price bar. Structural checks live in {@code BarValidator}; this record only carries values.
 */
public record Bar(
        long timestamp,
        long index,
        double open,
        double high,
        double low,
        double close,
        double delta
) {

    public double range() {
        return high - low;
    }

    public double body() {
        return Math.abs(close - open);
    }

    public int color() {
        return Double.compare(close, open);
    }

    public boolean contains(double price) {
        return low <= price && price <= high;
    }
}
