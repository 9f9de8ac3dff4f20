package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.Outcome;

/**
 * Append-only ledger entry. {@code live} is false for outcomes observed on shadow positions.
 */
public record ZoneOutcomeEvent(
        long sequence,
        ZoneId zoneId,
        Direction direction,
        Outcome outcome,
        RetestProfile retest,
        long barIndex,
        boolean live
) {

    public ZoneOutcomeEvent {
        if (zoneId == null || direction == null || outcome == null) {
            throw new IllegalArgumentException("zoneId, direction and outcome are required");
        }
        if (retest == null) {
            retest = RetestProfile.NONE;
        }
    }
}
