package org.nowstart.grammar.data.type;

public enum PipelineStatus {
    RUNNING,
    STALE,
    HALTED
}
