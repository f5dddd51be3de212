package com.rush.agent.service;

import lombok.Getter;

@Getter
public class PipelineStepException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineStepException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getReason() {
        return "transport_error";
    }
}
