package org.nowstart.grammar.engine.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Price band {@code [lower, upper)} that identifies a zone.
 */
public record ZoneId(long lower, long upper) {

    public ZoneId {
        if (upper <= lower) {
            throw new IllegalArgumentException("upper must be greater than lower");
        }
    }

    public static ZoneId of(double price, double width) {
        if (!Double.isFinite(price) || !(width > 0.0)) {
            throw new IllegalArgumentException("price must be finite and width positive");
        }
        long lower = (long) (Math.floor(price / width) * width);
        return new ZoneId(lower, (long) (lower + width));
    }

    @JsonValue
    public String label() {
        return lower + "-" + upper;
    }

    @Override
    public String toString() {
        return label();
    }
}
