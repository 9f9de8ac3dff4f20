package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.ExitReason;
import org.nowstart.grammar.data.type.Outcome;

public record PositionExit(
        String positionId,
        ZoneId zoneId,
        Direction direction,
        double entryPrice,
        double exitPrice,
        long entryIndex,
        long exitIndex,
        int barsHeld,
        double mfe,
        double pnl,
        Outcome outcome,
        ExitReason reason,
        int thetaAtEntry,
        double sizeMultiplier,
        boolean live,
        RetestProfile retest
) {

    public boolean writesLedger() {
        return reason != ExitReason.CANCELLED;
    }
}
