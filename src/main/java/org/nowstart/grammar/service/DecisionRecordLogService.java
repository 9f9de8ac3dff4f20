package org.nowstart.grammar.service;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.grammar.engine.core.BarDecision;
import org.nowstart.grammar.engine.core.DecisionRecord;
import org.nowstart.grammar.engine.core.IgnitionEvent;
import org.nowstart.grammar.engine.core.InstrumentSummary;
import org.nowstart.grammar.engine.core.PolicyDecision;
import org.nowstart.grammar.engine.core.PositionExit;
import org.nowstart.grammar.engine.core.PositionSnapshot;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DecisionRecordLogService {

    public void logBarDecision(BarDecision decision) {
        DecisionRecord record = decision.record();
        if (record != null) {
            log.info(
                    "event=decision_record instrument={} ts={} idx={} depth={} depth_slope={} terminal={} island_id={} burst_event={} dc_pre={} er={} delta={} channel={}",
                    decision.instrument(),
                    record.ts(),
                    record.idx(),
                    sanitizeMetricForLog(record.depth()),
                    sanitizeMetricForLog(record.depthSlope()),
                    record.terminal(),
                    record.islandId() == null ? "-" : record.islandId(),
                    record.burstEvent(),
                    sanitizeMetricForLog(record.dcPre()),
                    sanitizeMetricForLog(record.er()),
                    sanitizeMetricForLog(record.delta()),
                    sanitizeMetricForLog(record.channel())
            );
        } else {
            log.debug(
                    "event=bar_skipped instrument={} idx={} status={}",
                    decision.instrument(),
                    decision.barIndex(),
                    decision.status()
            );
        }

        PolicyDecision policy = decision.policy();
        if (policy != null) {
            logCandidate(decision, policy);
        }
        logExits(decision.instrument(), decision.exits());
    }

    public void logExits(String instrument, List<PositionExit> exits) {
        for (PositionExit exit : exits) {
            log.info(
                    "event=position_exit instrument={} position_id={} live={} zone={} direction={} entry={} exit={} entry_idx={} exit_idx={} bars_held={} mfe={} pnl={} outcome={} reason={} theta_at_entry={} size={}",
                    instrument,
                    exit.positionId(),
                    exit.live(),
                    exit.zoneId(),
                    exit.direction(),
                    sanitizeMetricForLog(exit.entryPrice()),
                    sanitizeMetricForLog(exit.exitPrice()),
                    exit.entryIndex(),
                    exit.exitIndex(),
                    exit.barsHeld(),
                    sanitizeMetricForLog(exit.mfe()),
                    sanitizeMetricForLog(exit.pnl()),
                    exit.outcome(),
                    exit.reason(),
                    exit.thetaAtEntry(),
                    exit.sizeMultiplier()
            );
        }
    }

    public void logHalted(String instrument, String reason) {
        log.error("event=pipeline_halted instrument={} reason=\"{}\"", instrument, escape(reason));
    }

    public void logAcknowledged(String instrument) {
        log.warn("event=pipeline_acknowledged instrument={}", instrument);
    }

    public void logFeedStale(InstrumentSummary summary) {
        log.warn(
                "event=feed_stale instrument={} last_idx={} last_arrival={}",
                summary.instrument(),
                summary.lastBarIndex(),
                summary.lastArrival()
        );
    }

    public void logSessionReset(String instrument, int clearedZones, int clearedEvents) {
        log.info(
                "event=session_reset instrument={} cleared_zones={} cleared_events={}",
                instrument,
                clearedZones,
                clearedEvents
        );
    }

    private void logCandidate(BarDecision decision, PolicyDecision policy) {
        IgnitionEvent ignition = decision.ignition();
        PositionSnapshot entered = decision.entered();
        if (policy.allowed()) {
            log.info(
                    "event=entry_allowed instrument={} idx={} direction={} price={} theta={} tier={} size={} retry_allowed={} trailing_allowed={} position_id={}",
                    decision.instrument(),
                    decision.barIndex(),
                    ignition.direction(),
                    sanitizeMetricForLog(ignition.price()),
                    policy.theta(),
                    policy.tier(),
                    policy.sizeMultiplier(),
                    policy.retryAllowed(),
                    policy.trailingAllowed(),
                    entered == null ? "-" : entered.id()
            );
            return;
        }

        log.info(
                "event=candidate_denied instrument={} idx={} direction={} price={} theta={} tier={} reason={} detail=\"{}\" shadow_id={}",
                decision.instrument(),
                decision.barIndex(),
                ignition.direction(),
                sanitizeMetricForLog(ignition.price()),
                policy.theta(),
                policy.tier(),
                policy.reasonCode(),
                escape(policy.detail()),
                entered == null ? "-" : entered.id()
        );
    }

    private String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private double sanitizeMetricForLog(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return value == -0.0 ? 0.0 : value;
    }
}
