package org.nowstart.grammar.data.type;

/**
 * Result of a closed position. {@link #BREAKEVEN} neither extends nor breaks a streak.
 */
public enum Outcome {
    WIN,
    LOSS,
    BREAKEVEN;

    public static Outcome ofPnl(double pnl) {
        if (pnl > 0.0) {
            return WIN;
        }
        return pnl < 0.0 ? LOSS : BREAKEVEN;
    }
}
