package org.nowstart.grammar.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.nowstart.grammar.engine.core.ExecutionFriction;

public record FrictionRequest(
        @NotNull(message = "slippage is required")
        @PositiveOrZero(message = "slippage must be non-negative")
        Double slippage,

        @NotNull(message = "spread is required")
        @PositiveOrZero(message = "spread must be non-negative")
        Double spread,

        @PositiveOrZero(message = "latencyMillis must be non-negative")
        Long latencyMillis
) {

    public ExecutionFriction toFriction() {
        return new ExecutionFriction(
                slippage,
                spread,
                Duration.ofMillis(latencyMillis == null ? 0L : latencyMillis)
        );
    }
}
