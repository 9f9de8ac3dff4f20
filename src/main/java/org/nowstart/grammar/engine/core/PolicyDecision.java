package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.EligibilityTier;
import org.nowstart.grammar.data.type.ReasonCode;
import org.nowstart.grammar.data.type.SizeTier;

public record PolicyDecision(
        boolean allowed,
        SizeTier size,
        boolean retryAllowed,
        boolean trailingAllowed,
        ReasonCode reasonCode,
        int theta,
        EligibilityTier tier,
        String detail
) {

    public PolicyDecision {
        if (size == null || reasonCode == null || tier == null) {
            throw new IllegalArgumentException("size, reasonCode and tier are required");
        }
        if (allowed == reasonCode.isDenial()) {
            throw new IllegalArgumentException("allowed decisions must carry ALLOWED and denials a denial code");
        }
    }

    public static PolicyDecision allow(SizeTier size, boolean retryAllowed, boolean trailingAllowed, int theta,
                                       EligibilityTier tier, String detail) {
        return new PolicyDecision(true, size, retryAllowed, trailingAllowed, ReasonCode.ALLOWED, theta, tier, detail);
    }

    public static PolicyDecision deny(ReasonCode reasonCode, int theta, EligibilityTier tier, String detail) {
        return new PolicyDecision(false, SizeTier.NONE, false, false, reasonCode, theta, tier, detail);
    }

    public double sizeMultiplier() {
        return size.multiplier();
    }
}
