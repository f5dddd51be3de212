package com.rush.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
