package com.rush.agent.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Getter
@Setter
public class PipelineProperties {

    @Value("${rush.pipeline.listener-timeout-ms:15000}")
    private long listenerTimeoutMs = 15000;

    @Value("${rush.pipeline.brain-timeout-ms:20000}")
    private long brainTimeoutMs = 20000;

    @Value("${rush.pipeline.fraud-timeout-ms:15000}")
    private long fraudTimeoutMs = 15000;

    @Value("${rush.pipeline.executor-timeout-ms:30000}")
    private long executorTimeoutMs = 30000;

    // slack on top of the transport's own timeout before the orchestrator gives up on the wait
    @Value("${rush.pipeline.wait-grace-ms:1000}")
    private long waitGraceMs = 1000;

    public long timeoutFor(PipelineStage stage) {
        return switch (stage) {
            case VOICE_LISTENER -> listenerTimeoutMs;
            case BRAIN -> brainTimeoutMs;
            case FRAUD_DETECTOR -> fraudTimeoutMs;
            case EXECUTOR -> executorTimeoutMs;
        };
    }
}
