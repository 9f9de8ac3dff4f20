package org.nowstart.grammar.data.exception;

import lombok.Getter;

/**
 * Not enough trailing bars to compute indicators. Recoverable: the bar is skipped, never filled with defaults.
 */
@Getter
public class InsufficientWindowException extends DecisionPipelineException {

    private final int available;
    private final int required;

    public InsufficientWindowException(int available, int required) {
        super("insufficient_window", "window has " + available + " bars, " + required + " required");
        this.available = available;
        this.required = required;
    }
}
