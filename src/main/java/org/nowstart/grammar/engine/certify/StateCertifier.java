package org.nowstart.grammar.engine.certify;

import java.util.Optional;
import org.nowstart.grammar.engine.core.Certification;
import org.nowstart.grammar.engine.core.IgnitionEvent;
import org.nowstart.grammar.engine.core.PersistenceRecord;
import org.nowstart.grammar.engine.core.Zone;

/**
 * Maps a zone's persistence record to θ. The only inputs are the record and the ignition, so the same
 * history always yields the same level. Each ignition may be certified once.
 */
public class StateCertifier {

    public static final String REASON_NO_RECORD = "no_record";
    public static final String REASON_DIRECTION_MISMATCH = "direction_mismatch";
    public static final String REASON_NEW_ZONE = "zone_created_this_bar";
    public static final String REASON_NO_WIN_STREAK = "no_win_streak";
    public static final String REASON_BIRTH = "birth";
    public static final String REASON_TRANSITION = "transition";
    public static final String REASON_TRANSITION_UNCORROBORATED = "transition_uncorroborated";
    public static final String REASON_LOCK_IN = "lock_in";

    private final TransitionCorroboration corroboration;
    private long lastConsumedIndex = Long.MIN_VALUE;

    public StateCertifier(TransitionCorroboration corroboration) {
        if (corroboration == null) {
            throw new IllegalArgumentException("corroboration is required");
        }
        this.corroboration = corroboration;
    }

    public Certification certify(IgnitionEvent ignition, Zone zone, Optional<PersistenceRecord> record) {
        if (ignition == null || zone == null || record == null) {
            throw new IllegalArgumentException("ignition, zone and record are required");
        }
        if (ignition.barIndex() <= lastConsumedIndex) {
            throw new IllegalStateException("ignition at bar " + ignition.barIndex() + " was already certified");
        }
        lastConsumedIndex = ignition.barIndex();

        if (zone.createdAt(ignition.barIndex())) {
            return Certification.none(REASON_NEW_ZONE);
        }
        if (record.isEmpty()) {
            return Certification.none(REASON_NO_RECORD);
        }

        PersistenceRecord persistence = record.get();
        if (persistence.direction() != ignition.direction()) {
            return Certification.none(REASON_DIRECTION_MISMATCH);
        }

        int winStreak = persistence.winStreak();
        if (winStreak <= 0) {
            return Certification.none(REASON_NO_WIN_STREAK);
        }
        if (winStreak == 1) {
            return Certification.of(1, winStreak, REASON_BIRTH);
        }
        if (winStreak == 2) {
            return corroboration.holds(persistence)
                    ? Certification.of(2, winStreak, REASON_TRANSITION)
                    : Certification.of(1, winStreak, REASON_TRANSITION_UNCORROBORATED);
        }
        return Certification.of(winStreak, winStreak, REASON_LOCK_IN);
    }
}
