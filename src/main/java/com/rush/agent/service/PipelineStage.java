package com.rush.agent.service;

public enum PipelineStage {
    VOICE_LISTENER("rush-voice-listener", "New voice support request: \"%s\""),
    BRAIN("rush-brain-agent", "Analyze this voice processing result: %s"),
    FRAUD_DETECTOR("rush-fraud-detector", "Perform fraud detection on: %s"),
    EXECUTOR("rush-executor-agent", "Execute blockchain resolution: %s");

    private final String agentId;
    private final String requestTemplate;

    PipelineStage(String agentId, String requestTemplate) {
        this.agentId = agentId;
        this.requestTemplate = requestTemplate;
    }

    public String getAgentId() {
        return agentId;
    }

    public String formatRequest(String payload) {
        return String.format(requestTemplate, payload);
    }
}
