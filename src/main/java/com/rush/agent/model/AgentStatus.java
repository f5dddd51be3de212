package com.rush.agent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    BUSY("busy");

    private final String value;

    AgentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AgentStatus fromValue(String value) {
        for (AgentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + value);
    }
}
