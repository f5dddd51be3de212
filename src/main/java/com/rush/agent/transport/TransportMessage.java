package com.rush.agent.transport;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransportMessage {
    private String id;
    private String threadId;
    private String agentId;
    private String content;
    private Instant timestamp;
    @Builder.Default
    private List<String> mentions = new ArrayList<>();
}
