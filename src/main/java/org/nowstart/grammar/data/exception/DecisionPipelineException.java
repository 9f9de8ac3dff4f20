package org.nowstart.grammar.data.exception;

import lombok.Getter;

/**
 * Base type for conditions raised inside one instrument's bar pipeline.
 */
@Getter
public abstract class DecisionPipelineException extends RuntimeException {

    private final String code;

    protected DecisionPipelineException(String code, String message) {
        super(message);
        this.code = code;
    }
}
