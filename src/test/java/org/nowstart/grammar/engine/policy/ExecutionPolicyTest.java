package org.nowstart.grammar.engine.policy;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.nowstart.grammar.data.property.GrammarProperties;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.data.type.EligibilityTier;
import org.nowstart.grammar.data.type.ReasonCode;
import org.nowstart.grammar.data.type.SizeTier;
import org.nowstart.grammar.engine.core.Certification;
import org.nowstart.grammar.engine.core.ExecutionFriction;
import org.nowstart.grammar.engine.core.PolicyDecision;
import org.nowstart.grammar.engine.core.PolicyRequest;
import org.nowstart.grammar.engine.core.RetestProfile;

class ExecutionPolicyTest {

    private static final RetestProfile IMPULSIVE = new RetestProfile(3, 2);
    private static final RetestProfile QUIET = new RetestProfile(1, 0);

    private final ExecutionPolicy policy = new ExecutionPolicy(GrammarProperties.defaults(), LockedDoctrine.V7_4);

    @Test
    void decide_deniesUncertifiedState() {
        PolicyDecision decision = policy.decide(request(0, QUIET));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reasonCode()).isEqualTo(ReasonCode.STATE_NOT_CERTIFIED);
        assertThat(decision.size()).isEqualTo(SizeTier.NONE);
        assertThat(decision.sizeMultiplier()).isZero();
    }

    @Test
    void decide_allowsBirthAtSingleSizeWithoutRetryOrTrailing() {
        PolicyDecision decision = policy.decide(request(1, IMPULSIVE));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reasonCode()).isEqualTo(ReasonCode.ALLOWED);
        assertThat(decision.sizeMultiplier()).isEqualTo(1.0);
        assertThat(decision.retryAllowed()).isFalse();
        assertThat(decision.trailingAllowed()).isFalse();
    }

    @Test
    void decide_doublesTransitionOnlyAfterImpulsiveRetest() {
        PolicyDecision impulsive = policy.decide(request(2, IMPULSIVE));
        PolicyDecision quiet = policy.decide(request(2, QUIET));
        PolicyDecision slowRecovery = policy.decide(request(2, new RetestProfile(3, 4)));

        assertThat(impulsive.sizeMultiplier()).isEqualTo(2.0);
        assertThat(impulsive.retryAllowed()).isTrue();
        assertThat(impulsive.trailingAllowed()).isFalse();
        assertThat(quiet.sizeMultiplier()).isEqualTo(1.0);
        assertThat(quiet.retryAllowed()).isFalse();
        assertThat(slowRecovery.sizeMultiplier()).isEqualTo(1.0);
    }

    @Test
    void decide_allowsLockInAtQuadrupleSizeWithRetryAndTrailing() {
        PolicyDecision decision = policy.decide(request(3, QUIET));

        assertThat(decision.sizeMultiplier()).isEqualTo(4.0);
        assertThat(decision.retryAllowed()).isTrue();
        assertThat(decision.trailingAllowed()).isTrue();
        assertThat(policy.decide(request(6, QUIET)).sizeMultiplier()).isEqualTo(4.0);
    }

    @Test
    void decide_disablesLockInTrailingWhenExtensionIsOff() {
        GrammarProperties defaults = GrammarProperties.defaults();
        GrammarProperties noExtension = new GrammarProperties(
                defaults.instruments(),
                defaults.channelLookback(),
                defaults.depthSlopeBars(),
                defaults.erLookback(),
                defaults.forceLookback(),
                defaults.dcLookback(),
                defaults.ignitionCooldownBars(),
                defaults.maxHoldingBars(),
                defaults.maxRetryAttempts(),
                false,
                defaults.shadowTracking(),
                defaults.staleFeedBound(),
                defaults.gate(),
                defaults.friction()
        );

        PolicyDecision decision = new ExecutionPolicy(noExtension, LockedDoctrine.V7_4).decide(request(3, QUIET));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.trailingAllowed()).isFalse();
    }

    @Test
    void decide_stepsSizeDownForStandardTier() {
        PolicyDecision lockIn = policy.decide(new PolicyRequest(Certification.of(3, 3, "lock_in"),
                EligibilityTier.STANDARD, false, false, ExecutionFriction.NONE, QUIET, false, 0, false));
        PolicyDecision birth = policy.decide(new PolicyRequest(Certification.of(1, 1, "birth"),
                EligibilityTier.STANDARD, false, false, ExecutionFriction.NONE, QUIET, false, 0, false));

        assertThat(lockIn.sizeMultiplier()).isEqualTo(2.0);
        assertThat(lockIn.tier()).isEqualTo(EligibilityTier.STANDARD);
        assertThat(birth.sizeMultiplier()).isEqualTo(1.0);
    }

    @Test
    void decide_appliesOverridesInOrder() {
        ExecutionFriction breach = new ExecutionFriction(3.5, 0.5, Duration.ZERO);

        PolicyDecision stale = policy.decide(new PolicyRequest(Certification.of(3, 3, "lock_in"),
                EligibilityTier.ELEVATED, true, true, breach, QUIET, false, 0, false));
        PolicyDecision collapsed = policy.decide(new PolicyRequest(Certification.of(3, 3, "lock_in"),
                EligibilityTier.ELEVATED, false, true, breach, QUIET, false, 0, false));
        PolicyDecision friction = policy.decide(new PolicyRequest(Certification.of(3, 3, "lock_in"),
                EligibilityTier.ELEVATED, false, false, breach, QUIET, false, 0, false));

        assertThat(stale.reasonCode()).isEqualTo(ReasonCode.STALE_FEED);
        assertThat(stale.theta()).isZero();
        assertThat(collapsed.reasonCode()).isEqualTo(ReasonCode.ZONE_COLLAPSED);
        assertThat(friction.reasonCode()).isEqualTo(ReasonCode.EXECUTION_FRICTION);
        assertThat(friction.detail()).contains("slippage=3.5");
    }

    @Test
    void decide_deniesSpreadAndLatencyBreaches() {
        PolicyDecision spread = policy.decide(new PolicyRequest(Certification.of(1, 1, "birth"),
                EligibilityTier.ELEVATED, false, false, new ExecutionFriction(0.0, 2.5, Duration.ZERO),
                QUIET, false, 0, false));
        PolicyDecision latency = policy.decide(new PolicyRequest(Certification.of(1, 1, "birth"),
                EligibilityTier.ELEVATED, false, false, new ExecutionFriction(0.0, 0.0, Duration.ofMillis(800)),
                QUIET, false, 0, false));
        PolicyDecision atBounds = policy.decide(new PolicyRequest(Certification.of(1, 1, "birth"),
                EligibilityTier.ELEVATED, false, false, new ExecutionFriction(3.0, 2.0, Duration.ofMillis(500)),
                QUIET, false, 0, false));

        assertThat(spread.reasonCode()).isEqualTo(ReasonCode.EXECUTION_FRICTION);
        assertThat(latency.reasonCode()).isEqualTo(ReasonCode.EXECUTION_FRICTION);
        assertThat(atBounds.allowed()).isTrue();
    }

    @Test
    void decide_deniesRetryWhenLevelDoesNotPermitIt() {
        PolicyDecision birthRetry = policy.decide(new PolicyRequest(Certification.of(1, 1, "birth"),
                EligibilityTier.ELEVATED, false, false, ExecutionFriction.NONE, IMPULSIVE, true, 0, false));
        PolicyDecision transitionBudgetSpent = policy.decide(new PolicyRequest(Certification.of(2, 2, "transition"),
                EligibilityTier.ELEVATED, false, false, ExecutionFriction.NONE, IMPULSIVE, true, 1, false));
        PolicyDecision transitionRetry = policy.decide(new PolicyRequest(Certification.of(2, 2, "transition"),
                EligibilityTier.ELEVATED, false, false, ExecutionFriction.NONE, IMPULSIVE, true, 0, false));
        PolicyDecision lockInRetry = policy.decide(new PolicyRequest(Certification.of(3, 3, "lock_in"),
                EligibilityTier.ELEVATED, false, false, ExecutionFriction.NONE, QUIET, true, 5, false));

        assertThat(birthRetry.reasonCode()).isEqualTo(ReasonCode.RETRY_NOT_PERMITTED);
        assertThat(transitionBudgetSpent.reasonCode()).isEqualTo(ReasonCode.RETRY_NOT_PERMITTED);
        assertThat(transitionRetry.allowed()).isTrue();
        assertThat(lockInRetry.allowed()).isTrue();
    }

    @Test
    void decide_deniesWhileLivePositionIsOpen() {
        PolicyDecision decision = policy.decide(new PolicyRequest(Certification.of(3, 3, "lock_in"),
                EligibilityTier.ELEVATED, false, false, ExecutionFriction.NONE, QUIET, false, 0, true));

        assertThat(decision.reasonCode()).isEqualTo(ReasonCode.POSITION_OPEN);
    }

    @Test
    void decide_neverAllowsWithoutCertificationWhateverTheOtherInputs() {
        for (EligibilityTier tier : EligibilityTier.values()) {
            for (boolean retry : new boolean[] {true, false}) {
                PolicyDecision decision = policy.decide(new PolicyRequest(Certification.none("no_record"),
                        tier, false, false, ExecutionFriction.NONE, IMPULSIVE, retry, 0, false));

                assertThat(decision.allowed()).isFalse();
            }
        }
    }

    private PolicyRequest request(int theta, RetestProfile retest) {
        return new PolicyRequest(
                Certification.of(theta, theta, "test"),
                EligibilityTier.ELEVATED,
                false,
                false,
                ExecutionFriction.NONE,
                retest,
                false,
                0,
                false
        );
    }
}
