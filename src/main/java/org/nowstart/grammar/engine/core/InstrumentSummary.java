package org.nowstart.grammar.engine.core;

import java.time.Instant;
import java.util.Map;
import org.nowstart.grammar.data.type.PipelineStatus;
import org.nowstart.grammar.data.type.ReasonCode;

/**
 * Immutable cross-instrument view of one pipeline.
 */
public record InstrumentSummary(
        String instrument,
        PipelineStatus status,
        String haltReason,
        Long lastBarIndex,
        Long lastBarTimestamp,
        Instant lastArrival,
        int livePositions,
        int shadowPositions,
        int zones,
        int collapsedZones,
        long ignitions,
        Map<ReasonCode, Long> decisions
) {

    public InstrumentSummary {
        decisions = decisions == null ? Map.of() : Map.copyOf(decisions);
    }
}
