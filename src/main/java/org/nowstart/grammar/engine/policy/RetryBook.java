package org.nowstart.grammar.engine.policy;

import java.util.HashMap;
import java.util.Map;
import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.Outcome;
import org.nowstart.grammar.engine.core.ZoneId;

/**
 * Live entries taken per zone and direction during the current winning streak. A loss, or an outcome in
 * the other direction, starts the streak over.
 */
public class RetryBook {

    private final Map<Key, Integer> entries = new HashMap<>();

    public int entriesInStreak(ZoneId zoneId, Direction direction) {
        return entries.getOrDefault(new Key(zoneId, direction), 0);
    }

    public boolean isRetry(ZoneId zoneId, Direction direction) {
        return entriesInStreak(zoneId, direction) > 0;
    }

    public int retriesUsed(ZoneId zoneId, Direction direction) {
        return Math.max(0, entriesInStreak(zoneId, direction) - 1);
    }

    public void recordEntry(ZoneId zoneId, Direction direction) {
        entries.merge(new Key(zoneId, direction), 1, Integer::sum);
    }

    public void recordOutcome(ZoneId zoneId, Direction direction, Outcome outcome) {
        for (Direction other : Direction.values()) {
            if (other != direction) {
                entries.remove(new Key(zoneId, other));
            }
        }
        if (outcome == Outcome.LOSS) {
            entries.remove(new Key(zoneId, direction));
        }
    }

    public void reset() {
        entries.clear();
    }

    private record Key(ZoneId zoneId, Direction direction) {
    }
}
