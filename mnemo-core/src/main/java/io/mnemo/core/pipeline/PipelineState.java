package io.mnemo.core.pipeline;

public enum PipelineState {
    VALIDATE_INPUT,
    RETRIEVE,
    REINFORCE,
    SUMMARIZE,
    RECOMMEND,
    VALIDATE_OUTPUT,
    DONE,
    REJECTED,
    DEGRADED
}
