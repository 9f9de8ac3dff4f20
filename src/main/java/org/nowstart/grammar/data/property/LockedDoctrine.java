package org.nowstart.grammar.data.property;

/**
 * Locked decision constants. Instances are immutable and versioned; the only way to change a value is to
 * ship a new version through out-of-band validation, never through configuration reload.
 *
 * @param version              doctrine version label
 * @param mfeThreshold         MFE at which a position starts trailing
 * @param trailOffset          distance kept between MFE and the trailing stop
 * @param lwsBars              bars after which a low-MFE position escalates to the defensive stop
 * @param lwsMfeThreshold      MFE under which the loss-warning state fires
 * @param defenseStopLoss      stop-loss distance once escalated
 * @param defaultStopLoss      initial stop-loss distance
 * @param takeProfit           fixed take-profit distance
 * @param zoneWidth            price band width used to quantize zones
 * @param retestImpulseMin     retest count must exceed this for the TRANSITION retry condition
 * @param retestRecoveryMaxBars recovery must take fewer bars than this to count as fast
 */
public record LockedDoctrine(
        String version,
        double mfeThreshold,
        double trailOffset,
        int lwsBars,
        double lwsMfeThreshold,
        double defenseStopLoss,
        double defaultStopLoss,
        double takeProfit,
        double zoneWidth,
        int retestImpulseMin,
        int retestRecoveryMaxBars
) {

    public static final LockedDoctrine V7_4 = new LockedDoctrine(
            "v7.4",
            7.0,
            1.5,
            4,
            1.5,
            12.0,
            30.0,
            20.0,
            100.0,
            2,
            4
    );

    public LockedDoctrine {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("doctrine version is required");
        }
        if (!(mfeThreshold > 0.0) || !(trailOffset >= 0.0) || trailOffset >= mfeThreshold) {
            throw new IllegalArgumentException("trailOffset must be in [0, mfeThreshold)");
        }
        if (lwsBars <= 0 || !(lwsMfeThreshold >= 0.0)) {
            throw new IllegalArgumentException("loss-warning bars and MFE threshold must be positive");
        }
        if (!(defenseStopLoss > 0.0) || defenseStopLoss > defaultStopLoss) {
            throw new IllegalArgumentException("defenseStopLoss must be in (0, defaultStopLoss]");
        }
        if (!(takeProfit > 0.0) || !(zoneWidth > 0.0)) {
            throw new IllegalArgumentException("takeProfit and zoneWidth must be positive");
        }
        if (retestImpulseMin < 0 || retestRecoveryMaxBars <= 0) {
            throw new IllegalArgumentException("retest bounds must be non-negative");
        }
    }
}
