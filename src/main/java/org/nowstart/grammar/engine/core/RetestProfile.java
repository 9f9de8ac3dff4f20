package org.nowstart.grammar.engine.core;

/**
 * How a closed position behaved around its entry price.
 *
 * @param retestCount  bars after entry whose range touched the entry price
 * @param recoveryBars longest run of consecutive closes on the adverse side of entry
 */
public record RetestProfile(int retestCount, int recoveryBars) {

    public static final RetestProfile NONE = new RetestProfile(0, 0);

    public RetestProfile {
        if (retestCount < 0 || recoveryBars < 0) {
            throw new IllegalArgumentException("retest counters must be non-negative");
        }
    }
}
