package org.nowstart.grammar.engine.zone;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.Outcome;
import org.nowstart.grammar.engine.core.PersistenceRecord;
import org.nowstart.grammar.engine.core.RetestProfile;
import org.nowstart.grammar.engine.core.Zone;
import org.nowstart.grammar.engine.core.ZoneId;
import org.nowstart.grammar.engine.core.ZoneOutcomeEvent;

/**
 * Event-sourced outcome history per zone. The event log is append-only; records are a projection that
 * {@link #replay(List)} rebuilds identically. Single writer: the owning instrument pipeline.
 */
public class ZoneLedger {

    static final int COLLAPSE_LOSS_STREAK = 2;

    private final double zoneWidth;
    private final List<ZoneOutcomeEvent> events = new ArrayList<>();
    private final Map<ZoneId, PersistenceRecord> records = new LinkedHashMap<>();
    private final Map<ZoneId, Zone> zones = new LinkedHashMap<>();

    public ZoneLedger(LockedDoctrine doctrine) {
        this.zoneWidth = doctrine.zoneWidth();
    }

    public Zone touch(double price, long barIndex) {
        ZoneId zoneId = ZoneId.of(price, zoneWidth);
        return zones.computeIfAbsent(zoneId, id -> new Zone(id, barIndex));
    }

    public ZoneId zoneOf(double price) {
        return ZoneId.of(price, zoneWidth);
    }

    public Optional<PersistenceRecord> query(ZoneId zoneId) {
        return Optional.ofNullable(records.get(zoneId));
    }

    public boolean isCollapsed(ZoneId zoneId) {
        PersistenceRecord record = records.get(zoneId);
        return record != null && record.collapsed();
    }

    public ZoneOutcomeEvent recordOutcome(
            ZoneId zoneId,
            Direction direction,
            Outcome outcome,
            RetestProfile retest,
            long barIndex,
            boolean live
    ) {
        ZoneOutcomeEvent event = new ZoneOutcomeEvent(
                events.size() + 1L,
                zoneId,
                direction,
                outcome,
                retest,
                barIndex,
                live
        );
        events.add(event);
        apply(event);
        return event;
    }

    public void replay(List<ZoneOutcomeEvent> history) {
        events.clear();
        records.clear();
        for (ZoneOutcomeEvent event : history) {
            events.add(event);
            apply(event);
        }
    }

    public List<ZoneOutcomeEvent> events() {
        return List.copyOf(events);
    }

    public Collection<PersistenceRecord> records() {
        return List.copyOf(records.values());
    }

    public int zoneCount() {
        return zones.size();
    }

    public void reset() {
        events.clear();
        records.clear();
        zones.clear();
    }

    private void apply(ZoneOutcomeEvent event) {
        PersistenceRecord previous = records.get(event.zoneId());
        boolean continuing = previous != null && previous.direction() == event.direction();

        int sameDirectionCount = continuing ? previous.consecutiveSameDirectionCount() + 1 : 1;
        int winStreak;
        int lossStreak;
        RetestProfile retest = event.retest();
        switch (event.outcome()) {
            case WIN -> {
                winStreak = continuing ? previous.winStreak() + 1 : 1;
                lossStreak = 0;
            }
            case LOSS -> {
                winStreak = 0;
                lossStreak = continuing ? previous.lossStreak() + 1 : 1;
            }
            default -> {
                // breakeven carries the streaks and the retest of the last decisive trade
                winStreak = continuing ? previous.winStreak() : 0;
                lossStreak = continuing ? previous.lossStreak() : 0;
                retest = continuing ? previous.lastRetest() : RetestProfile.NONE;
            }
        }
        boolean collapsed = (previous != null && previous.collapsed()) || lossStreak >= COLLAPSE_LOSS_STREAK;

        records.put(event.zoneId(), new PersistenceRecord(
                event.zoneId(),
                event.direction(),
                sameDirectionCount,
                winStreak,
                lossStreak,
                event.outcome(),
                retest,
                collapsed,
                event.barIndex()
        ));
    }
}
