package org.nowstart.grammar.engine.core;

public record Zone(ZoneId id, long creationIndex) {

    public Zone {
        if (id == null) {
            throw new IllegalArgumentException("zone id is required");
        }
    }

    public boolean createdAt(long barIndex) {
        return creationIndex == barIndex;
    }
}
