package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.PositionState;

/**
 * Read-only view of a tracked position. {@code trailStop} is null until the MFE threshold is crossed and
 * {@code takeProfit} is null while the position runs on extension.
 */
public record PositionSnapshot(
        String id,
        ZoneId zoneId,
        Direction direction,
        double entryPrice,
        long entryIndex,
        int barsHeld,
        double mfe,
        Double trailStop,
        double stopLoss,
        Double takeProfit,
        int thetaAtEntry,
        PositionState state,
        boolean defenseActive,
        double sizeMultiplier,
        boolean extensionEnabled,
        boolean live
) {
}
