package org.nowstart.grammar.engine.risk;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.ExitReason;
import org.nowstart.grammar.data.type.Outcome;
import org.nowstart.grammar.data.type.PositionState;
import org.nowstart.grammar.engine.core.Bar;
import org.nowstart.grammar.engine.core.IgnitionEvent;
import org.nowstart.grammar.engine.core.PolicyDecision;
import org.nowstart.grammar.engine.core.PositionExit;
import org.nowstart.grammar.engine.core.PositionSnapshot;
import org.nowstart.grammar.engine.core.RetestProfile;
import org.nowstart.grammar.engine.core.ZoneId;

/**
 * Owns open positions and walks each through OPEN, TRAILING and CLOSED on every bar. Once MFE reaches the
 * doctrine threshold the stop only moves in the position's favour. The defensive stop escalation is one-way.
 * Not thread-safe; one instance per instrument.
 */
public class RiskController {

    private final LockedDoctrine doctrine;
    private final int maxHoldingBars;
    private final List<TrackedPosition> positions = new ArrayList<>();
    private long sequence;

    public RiskController(LockedDoctrine doctrine, int maxHoldingBars) {
        if (doctrine == null) {
            throw new IllegalArgumentException("doctrine is required");
        }
        if (maxHoldingBars <= 0) {
            throw new IllegalArgumentException("maxHoldingBars must be positive");
        }
        this.doctrine = doctrine;
        this.maxHoldingBars = maxHoldingBars;
    }

    public PositionSnapshot open(IgnitionEvent ignition, ZoneId zoneId, PolicyDecision decision, boolean live) {
        if (ignition == null || zoneId == null || decision == null) {
            throw new IllegalArgumentException("ignition, zoneId and decision are required");
        }
        boolean extension = decision.trailingAllowed();
        double sizeMultiplier = live ? decision.sizeMultiplier() : 0.0;
        TrackedPosition position = new TrackedPosition(
                (live ? "P" : "S") + (++sequence),
                zoneId,
                ignition.direction(),
                ignition.price(),
                ignition.barIndex(),
                decision.theta(),
                sizeMultiplier,
                extension,
                live
        );
        positions.add(position);
        return position.snapshot();
    }

    /**
     * Advances every position opened before {@code bar} by one bar and returns the ones that closed on it.
     */
    public List<PositionExit> update(Bar bar) {
        List<PositionExit> exits = new ArrayList<>();
        Iterator<TrackedPosition> iterator = positions.iterator();
        while (iterator.hasNext()) {
            TrackedPosition position = iterator.next();
            if (position.entryIndex >= bar.index()) {
                continue;
            }
            PositionExit exit = position.advance(bar);
            if (exit != null) {
                exits.add(exit);
                iterator.remove();
            }
        }
        return exits;
    }

    public List<PositionExit> flatten(double lastClose, long lastIndex) {
        List<PositionExit> exits = new ArrayList<>(positions.size());
        for (TrackedPosition position : positions) {
            exits.add(position.close(lastClose, lastIndex, ExitReason.CANCELLED));
        }
        positions.clear();
        return exits;
    }

    public boolean hasLivePosition() {
        return positions.stream().anyMatch(position -> position.live);
    }

    public boolean isTracking(ZoneId zoneId, Direction direction) {
        return positions.stream()
                .anyMatch(position -> position.zoneId.equals(zoneId) && position.direction == direction);
    }

    public List<PositionSnapshot> positions() {
        return positions.stream().map(TrackedPosition::snapshot).toList();
    }

    private final class TrackedPosition {

        private final String id;
        private final ZoneId zoneId;
        private final Direction direction;
        private final double entryPrice;
        private final long entryIndex;
        private final int thetaAtEntry;
        private final double sizeMultiplier;
        private final boolean extensionEnabled;
        private final boolean live;
        private final Double takeProfit;

        private PositionState state = PositionState.OPEN;
        private int barsHeld;
        private double mfe;
        private Double trailStop;
        private double stopLoss;
        private boolean defenseActive;
        private int retestCount;
        private int adverseRun;
        private int longestAdverseRun;

        private TrackedPosition(
                String id,
                ZoneId zoneId,
                Direction direction,
                double entryPrice,
                long entryIndex,
                int thetaAtEntry,
                double sizeMultiplier,
                boolean extensionEnabled,
                boolean live
        ) {
            this.id = id;
            this.zoneId = zoneId;
            this.direction = direction;
            this.entryPrice = entryPrice;
            this.entryIndex = entryIndex;
            this.thetaAtEntry = thetaAtEntry;
            this.sizeMultiplier = sizeMultiplier;
            this.extensionEnabled = extensionEnabled;
            this.live = live;
            this.stopLoss = direction.offset(entryPrice, -doctrine.defaultStopLoss());
            this.takeProfit = extensionEnabled ? null : direction.offset(entryPrice, doctrine.takeProfit());
        }

        private PositionExit advance(Bar bar) {
            barsHeld++;
            trackRetest(bar);

            if (!defenseActive && barsHeld >= doctrine.lwsBars() && mfe < doctrine.lwsMfeThreshold()) {
                defenseActive = true;
                stopLoss = tighter(stopLoss, direction.offset(entryPrice, -doctrine.defenseStopLoss()));
            }

            PositionExit protective = checkProtectiveLevels(bar);
            if (protective != null) {
                return protective;
            }

            double favorableExtreme = direction == Direction.LONG ? bar.high() : bar.low();
            mfe = Math.max(mfe, direction.favorable(entryPrice, favorableExtreme));
            if (mfe >= doctrine.mfeThreshold()) {
                double candidate = direction.offset(entryPrice, mfe - doctrine.trailOffset());
                if (trailStop == null) {
                    trailStop = candidate;
                    state = PositionState.TRAILING;
                } else {
                    trailStop = tighter(trailStop, candidate);
                }
            }

            if (trailStop != null && direction.favorable(trailStop, bar.close()) < 0.0) {
                return close(trailStop, bar.index(), ExitReason.TRAIL_STOP);
            }
            if (barsHeld >= maxHoldingBars) {
                return close(bar.close(), bar.index(), ExitReason.TIMEOUT);
            }
            return null;
        }

        private PositionExit checkProtectiveLevels(Bar bar) {
            double stop = effectiveStop();
            if (direction.favorable(stop, bar.open()) <= 0.0) {
                return close(bar.open(), bar.index(), ExitReason.GAP_STOP);
            }
            if (takeProfit != null && direction.favorable(takeProfit, bar.open()) >= 0.0) {
                return close(bar.open(), bar.index(), ExitReason.GAP_TARGET);
            }

            double adverseExtreme = direction == Direction.LONG ? bar.low() : bar.high();
            if (direction.favorable(stop, adverseExtreme) <= 0.0) {
                return close(stop, bar.index(), stopReason(stop));
            }

            double favorableExtreme = direction == Direction.LONG ? bar.high() : bar.low();
            if (takeProfit != null && direction.favorable(takeProfit, favorableExtreme) >= 0.0) {
                return close(takeProfit, bar.index(), ExitReason.TAKE_PROFIT);
            }
            return null;
        }

        private double effectiveStop() {
            return trailStop == null ? stopLoss : tighter(stopLoss, trailStop);
        }

        private ExitReason stopReason(double stop) {
            if (trailStop != null && stop == trailStop) {
                return ExitReason.TRAIL_STOP;
            }
            return defenseActive ? ExitReason.DEFENSE_STOP : ExitReason.STOP_LOSS;
        }

        private double tighter(double current, double candidate) {
            return direction.favorable(current, candidate) > 0.0 ? candidate : current;
        }

        private void trackRetest(Bar bar) {
            if (bar.contains(entryPrice)) {
                retestCount++;
            }
            if (direction.favorable(entryPrice, bar.close()) < 0.0) {
                adverseRun++;
                longestAdverseRun = Math.max(longestAdverseRun, adverseRun);
            } else {
                adverseRun = 0;
            }
        }

        private PositionExit close(double exitPrice, long exitIndex, ExitReason reason) {
            state = PositionState.CLOSED;
            double pnl = direction.favorable(entryPrice, exitPrice);
            return new PositionExit(
                    id,
                    zoneId,
                    direction,
                    entryPrice,
                    exitPrice,
                    entryIndex,
                    exitIndex,
                    barsHeld,
                    mfe,
                    pnl,
                    Outcome.ofPnl(pnl),
                    reason,
                    thetaAtEntry,
                    sizeMultiplier,
                    live,
                    new RetestProfile(retestCount, longestAdverseRun)
            );
        }

        private PositionSnapshot snapshot() {
            return new PositionSnapshot(
                    id,
                    zoneId,
                    direction,
                    entryPrice,
                    entryIndex,
                    barsHeld,
                    mfe,
                    trailStop,
                    stopLoss,
                    takeProfit,
                    thetaAtEntry,
                    state,
                    defenseActive,
                    sizeMultiplier,
                    extensionEnabled,
                    live
            );
        }
    }
}
