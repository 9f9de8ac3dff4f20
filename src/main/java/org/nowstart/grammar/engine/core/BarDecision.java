package org.nowstart.grammar.engine.core;

import java.util.List;
import org.nowstart.grammar.data.type.DecisionStatus;

/**
 * Result of feeding one bar to an instrument pipeline. Candidate-related fields are null when no ignition
 * fired; {@code record} is null when the window was still too short.
 */
public record BarDecision(
        String instrument,
        long barIndex,
        long timestamp,
        DecisionStatus status,
        DecisionRecord record,
        IgnitionEvent ignition,
        Certification certification,
        PolicyDecision policy,
        PositionSnapshot entered,
        List<PositionExit> exits,
        List<ZoneOutcomeEvent> outcomes
) {

    public BarDecision {
        exits = exits == null ? List.of() : List.copyOf(exits);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }
}
