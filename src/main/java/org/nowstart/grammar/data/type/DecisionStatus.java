package org.nowstart.grammar.data.type;

public enum DecisionStatus {
    NO_CANDIDATE,
    DECIDED,
    SKIPPED_INSUFFICIENT_WINDOW
}
