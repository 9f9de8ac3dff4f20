package org.nowstart.grammar.engine.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.nowstart.grammar.data.exception.CorruptBarException;
import org.nowstart.grammar.data.exception.InsufficientWindowException;
import org.nowstart.grammar.data.exception.PipelineHaltedException;
import org.nowstart.grammar.data.type.DecisionStatus;
import org.nowstart.grammar.data.type.PipelineStatus;
import org.nowstart.grammar.engine.certify.StateCertifier;
import org.nowstart.grammar.engine.core.Bar;
import org.nowstart.grammar.engine.core.BarDecision;
import org.nowstart.grammar.engine.core.Certification;
import org.nowstart.grammar.engine.core.DecisionRecord;
import org.nowstart.grammar.engine.core.ExecutionFriction;
import org.nowstart.grammar.engine.core.IgnitionEvent;
import org.nowstart.grammar.engine.core.IndicatorSet;
import org.nowstart.grammar.engine.core.InstrumentSummary;
import org.nowstart.grammar.engine.core.PersistenceRecord;
import org.nowstart.grammar.engine.core.PolicyDecision;
import org.nowstart.grammar.engine.core.PolicyRequest;
import org.nowstart.grammar.engine.core.PositionExit;
import org.nowstart.grammar.engine.core.PositionSnapshot;
import org.nowstart.grammar.engine.core.RetestProfile;
import org.nowstart.grammar.engine.core.Zone;
import org.nowstart.grammar.engine.core.ZoneOutcomeEvent;
import org.nowstart.grammar.engine.feature.FeatureExtractor;
import org.nowstart.grammar.engine.gate.EntryGate;
import org.nowstart.grammar.engine.gate.IgnitionGuard;
import org.nowstart.grammar.engine.policy.ExecutionPolicy;
import org.nowstart.grammar.engine.policy.RetryBook;
import org.nowstart.grammar.engine.risk.RiskController;
import org.nowstart.grammar.engine.zone.ZoneLedger;

/**
 * Per-instrument decision loop. Each bar is validated, turned into indicators, gated, certified against the
 * zone ledger and decided by the execution policy; positions opened on earlier bars are then advanced and
 * their outcomes written back, so certification on the next bar sees them.
 *
 * <p>Not thread-safe. Callers serialise access per instrument.
 */
public class InstrumentPipeline {

    private final String instrument;
    private final FeatureExtractor featureExtractor;
    private final EntryGate entryGate;
    private final IgnitionGuard ignitionGuard;
    private final ZoneLedger zoneLedger;
    private final StateCertifier stateCertifier;
    private final ExecutionPolicy executionPolicy;
    private final RetryBook retryBook;
    private final RiskController riskController;
    private final BarValidator barValidator;
    private final DecisionStatistics statistics = new DecisionStatistics();
    private final Deque<Bar> window = new ArrayDeque<>();
    private final Duration staleFeedBound;
    private final boolean shadowTracking;
    private final Clock clock;

    private PipelineStatus status = PipelineStatus.RUNNING;
    private String haltReason;
    private boolean staleFlag;
    private ExecutionFriction friction = ExecutionFriction.NONE;
    private Bar lastBar;
    private Instant lastArrival;
    private long ignitions;

    InstrumentPipeline(
            String instrument,
            FeatureExtractor featureExtractor,
            EntryGate entryGate,
            IgnitionGuard ignitionGuard,
            ZoneLedger zoneLedger,
            StateCertifier stateCertifier,
            ExecutionPolicy executionPolicy,
            RetryBook retryBook,
            RiskController riskController,
            BarValidator barValidator,
            Duration staleFeedBound,
            boolean shadowTracking,
            Clock clock
    ) {
        this.instrument = instrument;
        this.featureExtractor = featureExtractor;
        this.entryGate = entryGate;
        this.ignitionGuard = ignitionGuard;
        this.zoneLedger = zoneLedger;
        this.stateCertifier = stateCertifier;
        this.executionPolicy = executionPolicy;
        this.retryBook = retryBook;
        this.riskController = riskController;
        this.barValidator = barValidator;
        this.staleFeedBound = staleFeedBound;
        this.shadowTracking = shadowTracking;
        this.clock = clock;
    }

    public BarDecision onBar(Bar bar) {
        if (status == PipelineStatus.HALTED) {
            throw new PipelineHaltedException(instrument, haltReason);
        }
        try {
            barValidator.validate(bar, lastBar);
        } catch (CorruptBarException exception) {
            status = PipelineStatus.HALTED;
            haltReason = exception.getMessage();
            throw exception;
        }

        boolean timestampGap = lastBar != null && bar.timestamp() - lastBar.timestamp() > staleFeedBound.toMillis();
        boolean staleFeed = staleFlag || timestampGap;
        staleFlag = false;
        status = PipelineStatus.RUNNING;
        lastBar = bar;
        lastArrival = clock.instant();

        window.addLast(bar);
        while (window.size() > featureExtractor.minimumBars()) {
            window.removeFirst();
        }

        DecisionStatus decisionStatus;
        DecisionRecord record = null;
        IgnitionEvent ignition = null;
        Certification certification = null;
        PolicyDecision decision = null;
        PositionSnapshot entered = null;
        try {
            IndicatorSet indicators = featureExtractor.extract(List.copyOf(window));
            record = DecisionRecord.of(bar, indicators);
            Optional<IgnitionEvent> fired = entryGate.evaluate(indicators, bar);
            if (fired.isPresent()) {
                ignition = ignitionGuard.classify(fired.get());
                ignitions++;
                Zone zone = zoneLedger.touch(ignition.price(), bar.index());
                Optional<PersistenceRecord> persisted = zoneLedger.query(zone.id());
                certification = stateCertifier.certify(ignition, zone, persisted);
                decision = executionPolicy.decide(new PolicyRequest(
                        certification,
                        ignition.tier(),
                        staleFeed,
                        zoneLedger.isCollapsed(zone.id()),
                        friction,
                        persisted.map(PersistenceRecord::lastRetest).orElse(RetestProfile.NONE),
                        retryBook.isRetry(zone.id(), ignition.direction()),
                        retryBook.retriesUsed(zone.id(), ignition.direction()),
                        riskController.hasLivePosition()
                ));
                statistics.record(decision.reasonCode());
                entered = enter(ignition, zone, decision);
                decisionStatus = DecisionStatus.DECIDED;
            } else {
                decisionStatus = DecisionStatus.NO_CANDIDATE;
            }
        } catch (InsufficientWindowException exception) {
            decisionStatus = DecisionStatus.SKIPPED_INSUFFICIENT_WINDOW;
        }

        List<PositionExit> exits = riskController.update(bar);
        List<ZoneOutcomeEvent> outcomes = writeBack(exits);

        return new BarDecision(
                instrument,
                bar.index(),
                bar.timestamp(),
                decisionStatus,
                record,
                ignition,
                certification,
                decision,
                entered,
                exits,
                outcomes
        );
    }

    private PositionSnapshot enter(IgnitionEvent ignition, Zone zone, PolicyDecision decision) {
        if (decision.allowed()) {
            retryBook.recordEntry(zone.id(), ignition.direction());
            return riskController.open(ignition, zone.id(), decision, true);
        }
        if (shadowTracking && !riskController.isTracking(zone.id(), ignition.direction())) {
            return riskController.open(ignition, zone.id(), decision, false);
        }
        return null;
    }

    private List<ZoneOutcomeEvent> writeBack(List<PositionExit> exits) {
        List<ZoneOutcomeEvent> outcomes = new ArrayList<>(exits.size());
        for (PositionExit exit : exits) {
            if (!exit.writesLedger()) {
                continue;
            }
            outcomes.add(zoneLedger.recordOutcome(
                    exit.zoneId(),
                    exit.direction(),
                    exit.outcome(),
                    exit.retest(),
                    exit.exitIndex(),
                    exit.live()
            ));
            retryBook.recordOutcome(exit.zoneId(), exit.direction(), exit.outcome());
        }
        return outcomes;
    }

    /**
     * Cancels every tracked position at the last seen close. Cancelled positions leave no ledger outcome.
     */
    public List<PositionExit> flatten() {
        if (lastBar == null) {
            return List.of();
        }
        return riskController.flatten(lastBar.close(), lastBar.index());
    }

    public boolean acknowledge() {
        if (status != PipelineStatus.HALTED) {
            return false;
        }
        status = PipelineStatus.RUNNING;
        haltReason = null;
        return true;
    }

    public void resetSession() {
        zoneLedger.reset();
        retryBook.reset();
        ignitionGuard.reset();
    }

    public void updateFriction(ExecutionFriction friction) {
        if (friction == null) {
            throw new IllegalArgumentException("friction is required");
        }
        this.friction = friction;
    }

    /**
     * Flags the feed as stale when no bar arrived within the bound. Returns true only on the transition.
     */
    public boolean markStaleIfSilent(Instant now) {
        if (status != PipelineStatus.RUNNING || lastArrival == null) {
            return false;
        }
        if (Duration.between(lastArrival, now).compareTo(staleFeedBound) <= 0) {
            return false;
        }
        staleFlag = true;
        status = PipelineStatus.STALE;
        return true;
    }

    public String instrument() {
        return instrument;
    }

    public PipelineStatus status() {
        return status;
    }

    public ExecutionFriction friction() {
        return friction;
    }

    public Collection<PersistenceRecord> zones() {
        return zoneLedger.records();
    }

    public List<ZoneOutcomeEvent> ledgerEvents() {
        return zoneLedger.events();
    }

    public List<PositionSnapshot> positions() {
        return riskController.positions();
    }

    public InstrumentSummary summary() {
        List<PositionSnapshot> positions = riskController.positions();
        int live = (int) positions.stream().filter(PositionSnapshot::live).count();
        Collection<PersistenceRecord> records = zoneLedger.records();
        int collapsed = (int) records.stream().filter(PersistenceRecord::collapsed).count();
        return new InstrumentSummary(
                instrument,
                status,
                haltReason,
                lastBar == null ? null : lastBar.index(),
                lastBar == null ? null : lastBar.timestamp(),
                lastArrival,
                live,
                positions.size() - live,
                zoneLedger.zoneCount(),
                collapsed,
                ignitions,
                statistics.snapshot()
        );
    }
}
