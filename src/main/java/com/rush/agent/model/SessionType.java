package com.rush.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionType {
    VOICE_SUPPORT("voice_support"),
    PAYMENT_PROCESSING("payment_processing"),
    FRAUD_DETECTION("fraud_detection");

    private final String value;

    SessionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
