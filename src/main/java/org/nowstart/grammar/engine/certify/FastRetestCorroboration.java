package org.nowstart.grammar.engine.certify;

import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.engine.core.PersistenceRecord;
import org.nowstart.grammar.engine.core.RetestProfile;

/**
 * The last winning trade came back to its entry at least once and recovered quickly.
 */
public class FastRetestCorroboration implements TransitionCorroboration {

    private final int recoveryMaxBars;

    public FastRetestCorroboration(LockedDoctrine doctrine) {
        this.recoveryMaxBars = doctrine.retestRecoveryMaxBars();
    }

    @Override
    public boolean holds(PersistenceRecord record) {
        RetestProfile retest = record.lastRetest();
        return retest.retestCount() >= 1 && retest.recoveryBars() < recoveryMaxBars;
    }
}
