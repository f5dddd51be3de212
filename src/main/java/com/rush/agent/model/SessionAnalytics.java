package com.rush.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionAnalytics {
    private int totalSessions;
    private int activeSessions;
    private int completedSessions;
    private int failedSessions;
    private double averageDuration;
    private double averageSuccessRate;
    private long totalMessages;
}
