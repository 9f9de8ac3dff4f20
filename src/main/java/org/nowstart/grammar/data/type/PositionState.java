package org.nowstart.grammar.data.type;

public enum PositionState {
    OPEN,
    TRAILING,
    CLOSED
}
