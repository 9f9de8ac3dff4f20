package org.nowstart.grammar.data.type;

public enum ExitReason {
    STOP_LOSS,
    DEFENSE_STOP,
    TRAIL_STOP,
    TAKE_PROFIT,
    GAP_STOP,
    GAP_TARGET,
    TIMEOUT,
    CANCELLED
}
