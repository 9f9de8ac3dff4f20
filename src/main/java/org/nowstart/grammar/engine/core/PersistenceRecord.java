package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.Outcome;
import org.nowstart.grammar.data.type.ZoneStatus;

/**
 * Outcome history of one zone, as projected by the zone ledger. Replaced wholesale on every trade close.
 */
public record PersistenceRecord(
        ZoneId zoneId,
        Direction direction,
        int consecutiveSameDirectionCount,
        int winStreak,
        int lossStreak,
        Outcome lastOutcome,
        RetestProfile lastRetest,
        boolean collapsed,
        long updatedAtIndex
) {

    public PersistenceRecord {
        if (zoneId == null || direction == null || lastOutcome == null) {
            throw new IllegalArgumentException("zoneId, direction and lastOutcome are required");
        }
        if (lastRetest == null) {
            lastRetest = RetestProfile.NONE;
        }
    }

    public ZoneStatus status() {
        return collapsed ? ZoneStatus.COLLAPSED : ZoneStatus.ACTIVE;
    }
}
