package org.nowstart.grammar.data.exception;

import lombok.Getter;

@Getter
public class PipelineHaltedException extends DecisionPipelineException {

    private final String instrument;

    public PipelineHaltedException(String instrument, String haltReason) {
        super("pipeline_halted", "Pipeline for instrument=" + instrument + " is halted (" + haltReason
                + "); operator acknowledgement required");
        this.instrument = instrument;
    }
}
