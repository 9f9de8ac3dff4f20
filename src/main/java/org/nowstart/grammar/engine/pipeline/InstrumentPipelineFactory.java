package org.nowstart.grammar.engine.pipeline;

import java.time.Clock;
import org.nowstart.grammar.data.property.GrammarProperties;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.engine.certify.StateCertifier;
import org.nowstart.grammar.engine.certify.TransitionCorroboration;
import org.nowstart.grammar.engine.feature.FeatureExtractor;
import org.nowstart.grammar.engine.gate.EntryGate;
import org.nowstart.grammar.engine.gate.IgnitionGuard;
import org.nowstart.grammar.engine.policy.ExecutionPolicy;
import org.nowstart.grammar.engine.policy.RetryBook;
import org.nowstart.grammar.engine.risk.RiskController;
import org.nowstart.grammar.engine.zone.ZoneLedger;

/**
 * Builds fully independent pipelines. No component instance is shared between instruments.
 */
public class InstrumentPipelineFactory {

    private final GrammarProperties properties;
    private final LockedDoctrine doctrine;
    private final TransitionCorroboration corroboration;
    private final Clock clock;

    public InstrumentPipelineFactory(
            GrammarProperties properties,
            LockedDoctrine doctrine,
            TransitionCorroboration corroboration,
            Clock clock
    ) {
        if (properties == null || doctrine == null || corroboration == null || clock == null) {
            throw new IllegalArgumentException("properties, doctrine, corroboration and clock are required");
        }
        this.properties = properties;
        this.doctrine = doctrine;
        this.corroboration = corroboration;
        this.clock = clock;
    }

    public InstrumentPipeline create(String instrument) {
        if (instrument == null || instrument.isBlank()) {
            throw new IllegalArgumentException("instrument is required");
        }
        return new InstrumentPipeline(
                instrument,
                new FeatureExtractor(properties),
                new EntryGate(properties.gate()),
                new IgnitionGuard(properties.ignitionCooldownBars()),
                new ZoneLedger(doctrine),
                new StateCertifier(corroboration),
                new ExecutionPolicy(properties, doctrine),
                new RetryBook(),
                new RiskController(doctrine, properties.maxHoldingBars()),
                new BarValidator(instrument),
                properties.staleFeedBound(),
                properties.shadowTracking(),
                clock
        );
    }
}
