package org.nowstart.grammar.data.type;

public enum Terminal {
    FAST,
    SLOW
}
