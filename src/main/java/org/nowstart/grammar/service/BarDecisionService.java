package org.nowstart.grammar.service;

import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.grammar.data.dto.SessionResetResult;
import org.nowstart.grammar.data.entity.LedgerEvent;
import org.nowstart.grammar.data.exception.CorruptBarException;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.engine.core.Bar;
import org.nowstart.grammar.engine.core.BarDecision;
import org.nowstart.grammar.engine.core.ExecutionFriction;
import org.nowstart.grammar.engine.core.InstrumentSummary;
import org.nowstart.grammar.engine.core.PersistenceRecord;
import org.nowstart.grammar.engine.core.PositionExit;
import org.nowstart.grammar.engine.core.PositionSnapshot;
import org.nowstart.grammar.engine.core.ZoneOutcomeEvent;
import org.nowstart.grammar.engine.pipeline.InstrumentPipeline;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class BarDecisionService {

    private final InstrumentPipelineRegistry instrumentPipelineRegistry;
    private final DecisionRecordLogService decisionRecordLogService;
    private final LedgerJournalService ledgerJournalService;
    private final LockedDoctrine lockedDoctrine;
    private final Clock clock;

    public BarDecision process(String instrument, Bar bar) {
        BarDecision decision;
        try {
            decision = instrumentPipelineRegistry.execute(instrument, pipeline -> pipeline.onBar(bar));
        } catch (CorruptBarException e) {
            decisionRecordLogService.logHalted(e.getInstrument(), e.getViolation());
            throw e;
        }

        decisionRecordLogService.logBarDecision(decision);
        journal(decision.instrument(), decision.outcomes());
        return decision;
    }

    public List<PositionExit> flatten(String instrument) {
        List<PositionExit> exits = instrumentPipelineRegistry.execute(instrument, InstrumentPipeline::flatten);
        decisionRecordLogService.logExits(instrument, exits);
        return exits;
    }

    public InstrumentSummary acknowledge(String instrument) {
        return instrumentPipelineRegistry.execute(instrument, pipeline -> {
            if (pipeline.acknowledge()) {
                decisionRecordLogService.logAcknowledged(pipeline.instrument());
            }
            return pipeline.summary();
        });
    }

    public SessionResetResult resetSession(String instrument) {
        SessionResetResult result = instrumentPipelineRegistry.execute(instrument, pipeline -> {
            int zones = pipeline.zones().size();
            int events = pipeline.ledgerEvents().size();
            pipeline.resetSession();
            return new SessionResetResult(pipeline.instrument(), zones, events);
        });
        decisionRecordLogService.logSessionReset(result.instrument(), result.clearedZones(), result.clearedEvents());
        return result;
    }

    public ExecutionFriction updateFriction(String instrument, ExecutionFriction friction) {
        return instrumentPipelineRegistry.execute(instrument, pipeline -> {
            pipeline.updateFriction(friction);
            return pipeline.friction();
        });
    }

    public List<PersistenceRecord> zones(String instrument) {
        return instrumentPipelineRegistry.execute(instrument, pipeline -> List.copyOf(pipeline.zones()));
    }

    public List<ZoneOutcomeEvent> ledgerEvents(String instrument) {
        return instrumentPipelineRegistry.execute(instrument, InstrumentPipeline::ledgerEvents);
    }

    public List<LedgerEvent> journalHistory(String instrument) {
        String resolved = instrumentPipelineRegistry.execute(instrument, InstrumentPipeline::instrument);
        return ledgerJournalService.history(resolved);
    }

    public List<PositionSnapshot> positions(String instrument) {
        return instrumentPipelineRegistry.execute(instrument, InstrumentPipeline::positions);
    }

    public List<InstrumentSummary> summaries() {
        return instrumentPipelineRegistry.summaries();
    }

    public LockedDoctrine doctrine() {
        return lockedDoctrine;
    }

    public void markStaleFeeds() {
        for (String instrument : instrumentPipelineRegistry.instruments()) {
            try {
                InstrumentSummary stale = instrumentPipelineRegistry.execute(
                        instrument,
                        pipeline -> pipeline.markStaleIfSilent(clock.instant()) ? pipeline.summary() : null
                );
                if (stale != null) {
                    decisionRecordLogService.logFeedStale(stale);
                }
            } catch (Exception e) {
                log.error("Failed to check feed staleness instrument={}", instrument, e);
            }
        }
    }

    private void journal(String instrument, List<ZoneOutcomeEvent> outcomes) {
        if (outcomes.isEmpty()) {
            return;
        }
        try {
            ledgerJournalService.journal(instrument, outcomes);
        } catch (Exception e) {
            log.error("Failed to journal ledger outcomes instrument={} count={}", instrument, outcomes.size(), e);
        }
    }
}
