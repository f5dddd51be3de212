package com.rush.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetrics {
    private String sessionId;
    private long duration;
    private int messageCount;
    private int participantCount;
    private SessionStatus status;
    private double successRate;
    private double avgResponseTime;
}
