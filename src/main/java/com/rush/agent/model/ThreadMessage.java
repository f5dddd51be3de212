package com.rush.agent.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class ThreadMessage {

    public static final String SYSTEM_AGENT = "system";

    String id;
    String agent;
    JsonNode content;
    Instant timestamp;
    MessageType type;
    @Singular
    List<String> mentions;
}
