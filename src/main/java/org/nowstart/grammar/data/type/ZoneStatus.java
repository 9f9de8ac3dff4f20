package org.nowstart.grammar.data.type;

public enum ZoneStatus {
    ACTIVE,
    COLLAPSED
}
