package org.nowstart.grammar.data.exception;

import lombok.Getter;

/**
 * Malformed input bar. Fatal for the instrument pipeline until an operator acknowledges it.
 */
@Getter
public class CorruptBarException extends DecisionPipelineException {

    private final String instrument;
    private final String violation;

    public CorruptBarException(String instrument, String violation) {
        super("corrupt_bar", "Corrupt bar for instrument=" + instrument + ": " + violation);
        this.instrument = instrument;
        this.violation = violation;
    }
}
