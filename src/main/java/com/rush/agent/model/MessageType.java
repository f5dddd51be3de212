package com.rush.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    REQUEST("request"),
    RESPONSE("response"),
    COORDINATION("coordination"),
    ERROR("error");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
