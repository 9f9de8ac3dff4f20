package org.nowstart.grammar.data.dto;

public record SessionResetResult(
        String instrument,
        int clearedZones,
        int clearedEvents
) {
}
