package org.nowstart.grammar.data.type;

public enum ReasonCode {
    ALLOWED(false),
    STATE_NOT_CERTIFIED(true),
    ZONE_COLLAPSED(true),
    EXECUTION_FRICTION(true),
    STALE_FEED(true),
    RETRY_NOT_PERMITTED(true),
    POSITION_OPEN(true);

    private final boolean denial;

    ReasonCode(boolean denial) {
        this.denial = denial;
    }

    public boolean isDenial() {
        return denial;
    }
}
