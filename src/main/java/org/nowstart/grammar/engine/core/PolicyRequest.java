package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.EligibilityTier;

/**
 * Everything the execution policy needs for one candidate.
 *
 * @param retest       retest profile of the zone's last closed trade
 * @param retry        a live entry was already taken in this zone and direction during the current streak
 * @param retriesUsed  live re-entries already taken during the current streak
 * @param positionOpen a live position is currently open on the instrument
 */
public record PolicyRequest(
        Certification certification,
        EligibilityTier tier,
        boolean staleFeed,
        boolean zoneCollapsed,
        ExecutionFriction friction,
        RetestProfile retest,
        boolean retry,
        int retriesUsed,
        boolean positionOpen
) {

    public PolicyRequest {
        if (certification == null) {
            throw new IllegalArgumentException("certification is required");
        }
        if (tier == null) {
            tier = EligibilityTier.ELEVATED;
        }
        if (friction == null) {
            friction = ExecutionFriction.NONE;
        }
        if (retest == null) {
            retest = RetestProfile.NONE;
        }
    }
}
