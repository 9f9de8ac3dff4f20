package org.nowstart.grammar.data.dto;

import jakarta.validation.constraints.NotNull;
import org.nowstart.grammar.engine.core.Bar;

/**
 * Only presence is checked here. Price and ordering rules belong to {@code BarValidator}, which halts the
 * instrument on a corrupt bar.
 */
public record BarRequest(
        @NotNull(message = "timestamp is required")
        Long timestamp,

        @NotNull(message = "index is required")
        Long index,

        @NotNull(message = "open is required")
        Double open,

        @NotNull(message = "high is required")
        Double high,

        @NotNull(message = "low is required")
        Double low,

        @NotNull(message = "close is required")
        Double close,

        Double delta
) {

    public Bar toBar() {
        return new Bar(timestamp, index, open, high, low, close, delta == null ? 0.0 : delta);
    }
}
