package org.nowstart.grammar.engine.risk;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.EligibilityTier;
import org.nowstart.grammar.data.type.ExitReason;
import org.nowstart.grammar.data.type.Outcome;
import org.nowstart.grammar.data.type.PositionState;
import org.nowstart.grammar.data.type.ReasonCode;
import org.nowstart.grammar.data.type.SizeTier;
import org.nowstart.grammar.data.type.Terminal;
import org.nowstart.grammar.engine.core.Bar;
import org.nowstart.grammar.engine.core.IgnitionEvent;
import org.nowstart.grammar.engine.core.IndicatorSet;
import org.nowstart.grammar.engine.core.PolicyDecision;
import org.nowstart.grammar.engine.core.PositionExit;
import org.nowstart.grammar.engine.core.PositionSnapshot;
import org.nowstart.grammar.engine.core.ZoneId;

class RiskControllerTest {

    private static final ZoneId ZONE = new ZoneId(0, 100);
    private static final PolicyDecision BIRTH = PolicyDecision.allow(
            SizeTier.SMALL, false, false, 1, EligibilityTier.ELEVATED, "BIRTH");
    private static final PolicyDecision LOCK_IN = PolicyDecision.allow(
            SizeTier.LARGE, true, true, 3, EligibilityTier.ELEVATED, "LOCK_IN");

    private final RiskController controller = new RiskController(LockedDoctrine.V7_4, 180);

    @Test
    void open_setsDefaultStopAndTakeProfit() {
        PositionSnapshot position = controller.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);

        assertThat(position.stopLoss()).isEqualTo(70.0);
        assertThat(position.takeProfit()).isEqualTo(120.0);
        assertThat(position.trailStop()).isNull();
        assertThat(position.state()).isEqualTo(PositionState.OPEN);
        assertThat(position.sizeMultiplier()).isEqualTo(1.0);
        assertThat(position.live()).isTrue();
    }

    @Test
    void update_ignoresPositionOnItsEntryBar() {
        controller.open(ignition(5, Direction.LONG, 100.0), ZONE, BIRTH, true);

        List<PositionExit> exits = controller.update(bar(5, 100, 150, 50, 100));

        assertThat(exits).isEmpty();
        assertThat(controller.positions().get(0).barsHeld()).isZero();
    }

    @Test
    void update_raisesTrailFrom107_5To110_5() {
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, LOCK_IN, true);

        controller.update(bar(1, 100, 109, 99.5, 108));
        PositionSnapshot afterFirst = controller.positions().get(0);
        controller.update(bar(2, 108, 112, 107.8, 111.5));
        PositionSnapshot afterSecond = controller.positions().get(0);
        List<PositionExit> exits = controller.update(bar(3, 111.5, 111.6, 110, 110.2));

        assertThat(afterFirst.state()).isEqualTo(PositionState.TRAILING);
        assertThat(afterFirst.trailStop()).isEqualTo(107.5);
        assertThat(afterSecond.trailStop()).isEqualTo(110.5);
        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.TRAIL_STOP);
            assertThat(exit.exitPrice()).isEqualTo(110.5);
            assertThat(exit.outcome()).isEqualTo(Outcome.WIN);
        });
    }

    @Test
    void update_neverLoosensTrail() {
        controller.open(ignition(0, Direction.SHORT, 1000.0), ZONE, LOCK_IN, true);

        controller.update(bar(1, 1000, 1001, 988, 989));
        double first = controller.positions().get(0).trailStop();
        controller.update(bar(2, 989, 989.4, 985, 986));
        double second = controller.positions().get(0).trailStop();
        controller.update(bar(3, 986, 986.4, 985.5, 986));
        double third = controller.positions().get(0).trailStop();

        assertThat(first).isEqualTo(989.5);
        assertThat(second).isEqualTo(986.5);
        assertThat(third).isEqualTo(986.5);
    }

    @Test
    void update_escalatesToDefenseStopAtFourthBarWithLowMfe() {
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);

        List<Double> stops = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            controller.update(bar(i, 100, 100.5, 98, 99.5));
            stops.add(controller.positions().get(0).stopLoss());
        }

        assertThat(stops).containsExactly(70.0, 70.0, 70.0, 88.0);
        assertThat(controller.positions().get(0).defenseActive()).isTrue();
    }

    @Test
    void update_keepsDefenseStopOnceEscalated() {
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);
        for (int i = 1; i <= 4; i++) {
            controller.update(bar(i, 100, 100.5, 98, 99.5));
        }

        controller.update(bar(5, 99.5, 105, 99, 104));
        controller.update(bar(6, 104, 106, 103, 105));
        PositionSnapshot recovered = controller.positions().get(0);
        List<PositionExit> exits = controller.update(bar(7, 95, 95, 87, 90));

        assertThat(recovered.mfe()).isEqualTo(6.0);
        assertThat(recovered.stopLoss()).isEqualTo(88.0);
        assertThat(recovered.defenseActive()).isTrue();
        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.DEFENSE_STOP);
            assertThat(exit.exitPrice()).isEqualTo(88.0);
            assertThat(exit.pnl()).isEqualTo(-12.0);
        });
    }

    @Test
    void update_skipsDefenseWhenMfeReachedThreshold() {
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);
        controller.update(bar(1, 100, 102, 99, 100));
        for (int i = 2; i <= 5; i++) {
            controller.update(bar(i, 100, 100.5, 99, 100));
        }

        assertThat(controller.positions().get(0).defenseActive()).isFalse();
        assertThat(controller.positions().get(0).stopLoss()).isEqualTo(70.0);
    }

    @Test
    void update_exitsAtOpenWhenBarGapsThroughStop() {
        controller.open(ignition(0, Direction.SHORT, 1000.0), ZONE, BIRTH, true);

        List<PositionExit> exits = controller.update(bar(1, 1040, 1045, 1035, 1042));

        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.GAP_STOP);
            assertThat(exit.exitPrice()).isEqualTo(1040.0);
            assertThat(exit.pnl()).isEqualTo(-40.0);
            assertThat(exit.outcome()).isEqualTo(Outcome.LOSS);
        });
    }

    @Test
    void update_exitsAtOpenWhenBarGapsThroughTarget() {
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);

        List<PositionExit> exits = controller.update(bar(1, 125, 126, 124, 125));

        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.GAP_TARGET);
            assertThat(exit.exitPrice()).isEqualTo(125.0);
        });
    }

    @Test
    void update_prefersStopWhenStopAndTargetShareBar() {
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);

        List<PositionExit> exits = controller.update(bar(1, 100, 121, 69, 100));

        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.STOP_LOSS);
            assertThat(exit.exitPrice()).isEqualTo(70.0);
        });
    }

    @Test
    void update_takesProfitUnlessExtensionIsEnabled() {
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, LOCK_IN, true);

        List<PositionExit> exits = controller.update(bar(1, 100, 121, 99, 120.5));

        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.TAKE_PROFIT);
            assertThat(exit.exitPrice()).isEqualTo(120.0);
            assertThat(exit.thetaAtEntry()).isEqualTo(1);
        });
        PositionSnapshot extended = controller.positions().get(0);
        assertThat(extended.extensionEnabled()).isTrue();
        assertThat(extended.takeProfit()).isNull();
        assertThat(extended.trailStop()).isEqualTo(119.5);
    }

    @Test
    void update_closesOnTimeout() {
        RiskController shortHold = new RiskController(LockedDoctrine.V7_4, 3);
        shortHold.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);

        shortHold.update(bar(1, 100, 102, 99, 101));
        shortHold.update(bar(2, 101, 102, 99, 101));
        List<PositionExit> exits = shortHold.update(bar(3, 101, 102, 99, 101.5));

        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.TIMEOUT);
            assertThat(exit.exitPrice()).isEqualTo(101.5);
            assertThat(exit.barsHeld()).isEqualTo(3);
        });
    }

    @Test
    void update_recordsTimeoutAtEntryAsBreakeven() {
        RiskController shortHold = new RiskController(LockedDoctrine.V7_4, 3);
        shortHold.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);

        shortHold.update(bar(1, 100, 102, 99, 101));
        shortHold.update(bar(2, 101, 102, 99, 101));
        List<PositionExit> exits = shortHold.update(bar(3, 101, 102, 99, 100));

        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.TIMEOUT);
            assertThat(exit.pnl()).isZero();
            assertThat(exit.outcome()).isEqualTo(Outcome.BREAKEVEN);
        });
    }

    @Test
    void update_recordsRetestProfile() {
        controller.open(ignition(0, Direction.SHORT, 1040.0), ZONE, BIRTH, true);

        controller.update(bar(1, 1039, 1041, 1036, 1038));
        controller.update(bar(2, 1038, 1045, 1037, 1042));
        controller.update(bar(3, 1042, 1044, 1038, 1041));
        List<PositionExit> exits = controller.update(bar(4, 1030, 1031, 1015, 1016));

        assertThat(exits).singleElement().satisfies(exit -> {
            assertThat(exit.retest().retestCount()).isEqualTo(3);
            assertThat(exit.retest().recoveryBars()).isEqualTo(2);
            assertThat(exit.reason()).isEqualTo(ExitReason.TAKE_PROFIT);
        });
    }

    @Test
    void update_neverRealisesLossAfterMfeThresholdOnContinuousBars() {
        Random random = new Random(7L);
        List<PositionExit> exits = new ArrayList<>();

        for (int run = 0; run < 200; run++) {
            RiskController risk = new RiskController(LockedDoctrine.V7_4, 180);
            Direction direction = run % 2 == 0 ? Direction.LONG : Direction.SHORT;
            double close = 20_000.0;
            risk.open(ignition(0, direction, close), ZONE, run % 3 == 0 ? LOCK_IN : BIRTH, true);
            for (int i = 1; i <= 200 && risk.positions().size() == 1; i++) {
                double open = close;
                close = open + random.nextGaussian() * 4.0;
                double high = Math.max(open, close) + Math.abs(random.nextGaussian()) * 2.0;
                double low = Math.min(open, close) - Math.abs(random.nextGaussian()) * 2.0;
                exits.addAll(risk.update(bar(i, open, high, low, close)));
            }
        }

        assertThat(exits).isNotEmpty();
        assertThat(exits).filteredOn(exit -> exit.mfe() >= 7.0).isNotEmpty()
                .allSatisfy(exit -> assertThat(exit.pnl()).isPositive());
    }

    @Test
    void flatten_cancelsEveryPositionAtLastClose() {
        controller.open(ignition(0, Direction.LONG, 100.0), ZONE, BIRTH, true);
        controller.open(ignition(0, Direction.SHORT, 100.0), ZONE,
                PolicyDecision.deny(ReasonCode.STATE_NOT_CERTIFIED, 0, EligibilityTier.ELEVATED, "no_record"), false);

        List<PositionExit> exits = controller.flatten(97.0, 3);

        assertThat(exits).hasSize(2).allSatisfy(exit -> {
            assertThat(exit.reason()).isEqualTo(ExitReason.CANCELLED);
            assertThat(exit.exitPrice()).isEqualTo(97.0);
            assertThat(exit.writesLedger()).isFalse();
        });
        assertThat(controller.positions()).isEmpty();
        assertThat(controller.hasLivePosition()).isFalse();
    }

    @Test
    void isTracking_matchesZoneAndDirection() {
        controller.open(ignition(0, Direction.SHORT, 100.0), ZONE,
                PolicyDecision.deny(ReasonCode.ZONE_COLLAPSED, 0, EligibilityTier.ELEVATED, "collapsed"), false);

        assertThat(controller.isTracking(ZONE, Direction.SHORT)).isTrue();
        assertThat(controller.isTracking(ZONE, Direction.LONG)).isFalse();
        assertThat(controller.hasLivePosition()).isFalse();
        assertThat(controller.positions().get(0).sizeMultiplier()).isZero();
    }

    private IgnitionEvent ignition(long index, Direction direction, double price) {
        IndicatorSet indicators = new IndicatorSet(1.0, 50.0, 40.0, 1.0, 0.5, 1.0, 0.0, 0.5, 0.0, 1.0,
                Terminal.SLOW, 0.5, 1, false);
        return new IgnitionEvent(index, direction, price, indicators, EligibilityTier.ELEVATED);
    }

    private Bar bar(long index, double open, double high, double low, double close) {
        return new Bar(1_700_000_000_000L + index * 60_000L, index, open, high, low, close, 0.0);
    }
}
