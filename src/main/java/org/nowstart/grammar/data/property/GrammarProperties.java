package org.nowstart.grammar.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "grammar.engine")
public record GrammarProperties(
        // instruments whose pipelines are created at startup
        @NotNull @DefaultValue("NQ") List<String> instruments,
        // channel/depth/body z-score lookback
        @Positive @DefaultValue("20") int channelLookback,
        // depth slope distance in bars
        @Positive @DefaultValue("5") int depthSlopeBars,
        // efficiency ratio lookback
        @Positive @DefaultValue("10") int erLookback,
        // force ratio lookback
        @Positive @DefaultValue("10") int forceLookback,
        // dc_pre lookback
        @Positive @DefaultValue("10") int dcLookback,
        // bars after an ignition during which a new ignition counts as a re-entry
        @PositiveOrZero @DefaultValue("10") int ignitionCooldownBars,
        // positions still open after this many bars are closed at the bar close
        @Positive @DefaultValue("180") int maxHoldingBars,
        // live re-entries allowed at TRANSITION per zone and direction
        @PositiveOrZero @DefaultValue("1") int maxRetryAttempts,
        // LOCK_IN positions drop the fixed take-profit and run on the trail
        @DefaultValue("true") boolean lockInExtension,
        // denied candidates are followed as non-live positions so zone outcomes keep accruing
        @DefaultValue("true") boolean shadowTracking,
        // bar stream silence (wall clock or bar timestamps) treated as a stale feed
        @NotNull @DefaultValue("5m") Duration staleFeedBound,
        @NotNull @Valid @DefaultValue Gate gate,
        @NotNull @Valid @DefaultValue Friction friction
) {

    public static GrammarProperties defaults() {
        return new GrammarProperties(
                List.of("NQ"),
                20,
                5,
                10,
                10,
                10,
                10,
                180,
                1,
                true,
                true,
                Duration.ofMinutes(5),
                new Gate(1.5, 0.7, 80.0, 20.0, 1.0, 30.0),
                new Friction(3.0, 2.0, Duration.ofMillis(500))
        );
    }

    public int minimumWindow() {
        int indicatorWindow = Math.max(Math.max(erLookback, forceLookback), dcLookback);
        return Math.max(channelLookback + depthSlopeBars, indicatorWindow);
    }

    public record Gate(
            // SHORT requires directional ratio above this value
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.5") double shortRatioAbove,
            // LONG requires directional ratio below this value
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.7") double longRatioBelow,
            // SHORT requires channel % above this value
            @DecimalMin("0") @DecimalMax("100") @DefaultValue("80") double shortChannelAbove,
            // LONG requires channel % below this value
            @DecimalMin("0") @DecimalMax("100") @DefaultValue("20") double longChannelBelow,
            // |body z-score| floor
            @DecimalMin("0") @DefaultValue("1.0") double minBodyZScore,
            // channel high-low range floor in price units
            @DecimalMin("0") @DefaultValue("30") double minChannelRange
    ) {
    }

    public record Friction(
            @DecimalMin("0") @DefaultValue("3.0") double maxSlippage,
            @DecimalMin("0") @DefaultValue("2.0") double maxSpread,
            @NotNull @DefaultValue("500ms") Duration maxLatency
    ) {
    }
}
