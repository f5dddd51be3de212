package com.rush.agent.service;

import lombok.Getter;

@Getter
public class StepTimeoutException extends PipelineStepException {

    private final long timeoutMs;

    public StepTimeoutException(PipelineStage stage, long timeoutMs, Throwable cause) {
        super(stage, String.format("%s did not respond within %d ms", stage.getAgentId(), timeoutMs), cause);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getReason() {
        return "timeout";
    }
}
