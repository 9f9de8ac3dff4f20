package org.nowstart.grammar.engine.pipeline;

import org.nowstart.grammar.data.exception.CorruptBarException;
import org.nowstart.grammar.engine.core.Bar;

/**
 * Rejects bars that cannot be trusted: non-finite or non-positive prices, inverted ranges, open or close
 * outside the range, and timestamps or indexes that do not strictly increase.
 */
public class BarValidator {

    private final String instrument;

    public BarValidator(String instrument) {
        this.instrument = instrument;
    }

    public void validate(Bar bar, Bar previous) {
        if (bar == null) {
            throw new CorruptBarException(instrument, "bar is missing");
        }
        requirePositive("open", bar.open());
        requirePositive("high", bar.high());
        requirePositive("low", bar.low());
        requirePositive("close", bar.close());
        if (!Double.isFinite(bar.delta())) {
            throw new CorruptBarException(instrument, "delta is not finite at index " + bar.index());
        }
        if (bar.high() < bar.low()) {
            throw new CorruptBarException(instrument, "high below low at index " + bar.index());
        }
        if (!bar.contains(bar.open()) || !bar.contains(bar.close())) {
            throw new CorruptBarException(instrument, "open/close outside range at index " + bar.index());
        }
        if (previous == null) {
            return;
        }
        if (bar.index() <= previous.index()) {
            throw new CorruptBarException(
                    instrument,
                    "index " + bar.index() + " does not follow " + previous.index()
            );
        }
        if (bar.timestamp() <= previous.timestamp()) {
            throw new CorruptBarException(
                    instrument,
                    "timestamp " + bar.timestamp() + " does not follow " + previous.timestamp()
            );
        }
    }

    private void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new CorruptBarException(instrument, field + " must be finite and positive but was " + value);
        }
    }
}
