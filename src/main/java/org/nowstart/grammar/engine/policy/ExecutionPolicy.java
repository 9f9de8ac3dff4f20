package org.nowstart.grammar.engine.policy;

import org.nowstart.grammar.data.property.GrammarProperties;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.data.type.CertificationLevel;
import org.nowstart.grammar.data.type.EligibilityTier;
import org.nowstart.grammar.data.type.ReasonCode;
import org.nowstart.grammar.data.type.SizeTier;
import org.nowstart.grammar.engine.core.ExecutionFriction;
import org.nowstart.grammar.engine.core.PolicyDecision;
import org.nowstart.grammar.engine.core.PolicyRequest;
import org.nowstart.grammar.engine.core.RetestProfile;

/**
 * Pure mapping from a certified candidate to an execution decision. Overrides are checked first and never
 * let a candidate through that certification would refuse.
 */
public class ExecutionPolicy {

    private final GrammarProperties.Friction frictionBounds;
    private final int maxRetryAttempts;
    private final boolean lockInExtension;
    private final int retestImpulseMin;
    private final int retestRecoveryMaxBars;

    public ExecutionPolicy(GrammarProperties properties, LockedDoctrine doctrine) {
        this.frictionBounds = properties.friction();
        this.maxRetryAttempts = properties.maxRetryAttempts();
        this.lockInExtension = properties.lockInExtension();
        this.retestImpulseMin = doctrine.retestImpulseMin();
        this.retestRecoveryMaxBars = doctrine.retestRecoveryMaxBars();
    }

    public PolicyDecision decide(PolicyRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }

        int theta = request.certification().theta();
        EligibilityTier tier = request.tier();

        if (request.staleFeed()) {
            return PolicyDecision.deny(ReasonCode.STALE_FEED, 0, tier, "feed exceeded staleness bound");
        }
        if (request.zoneCollapsed()) {
            return PolicyDecision.deny(ReasonCode.ZONE_COLLAPSED, theta, tier, "zone collapsed until session reset");
        }
        String frictionBreach = frictionBreach(request.friction());
        if (frictionBreach != null) {
            return PolicyDecision.deny(ReasonCode.EXECUTION_FRICTION, theta, tier, frictionBreach);
        }

        CertificationLevel level = request.certification().level();
        if (!level.isCertified()) {
            return PolicyDecision.deny(
                    ReasonCode.STATE_NOT_CERTIFIED,
                    theta,
                    tier,
                    request.certification().reason()
            );
        }

        SizeTier size;
        boolean retryAllowed;
        boolean trailingAllowed;
        switch (level) {
            case BIRTH -> {
                size = SizeTier.SMALL;
                retryAllowed = false;
                trailingAllowed = false;
            }
            case TRANSITION -> {
                boolean fastRetest = isFastRetest(request.retest());
                size = fastRetest ? SizeTier.MEDIUM : SizeTier.SMALL;
                retryAllowed = fastRetest && request.retriesUsed() < maxRetryAttempts;
                trailingAllowed = false;
            }
            default -> {
                size = SizeTier.LARGE;
                retryAllowed = true;
                trailingAllowed = lockInExtension;
            }
        }

        if (request.retry() && !retryAllowed) {
            return PolicyDecision.deny(
                    ReasonCode.RETRY_NOT_PERMITTED,
                    theta,
                    tier,
                    "retries_used=" + request.retriesUsed() + " level=" + level
            );
        }
        if (request.positionOpen()) {
            return PolicyDecision.deny(ReasonCode.POSITION_OPEN, theta, tier, "live position already open");
        }

        if (tier == EligibilityTier.STANDARD) {
            size = size.stepDown();
        }
        return PolicyDecision.allow(size, retryAllowed, trailingAllowed, theta, tier, level.name());
    }

    private boolean isFastRetest(RetestProfile retest) {
        return retest.retestCount() > retestImpulseMin && retest.recoveryBars() < retestRecoveryMaxBars;
    }

    private String frictionBreach(ExecutionFriction friction) {
        if (friction.slippage() > frictionBounds.maxSlippage()) {
            return "slippage=" + friction.slippage() + " max=" + frictionBounds.maxSlippage();
        }
        if (friction.spread() > frictionBounds.maxSpread()) {
            return "spread=" + friction.spread() + " max=" + frictionBounds.maxSpread();
        }
        if (friction.latency().compareTo(frictionBounds.maxLatency()) > 0) {
            return "latency=" + friction.latency().toMillis() + "ms max=" + frictionBounds.maxLatency().toMillis() + "ms";
        }
        return null;
    }
}
