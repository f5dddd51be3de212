package com.rush.agent.service;

import com.rush.agent.model.MessageType;
import com.rush.agent.model.SessionAnalytics;
import com.rush.agent.model.SessionMetrics;
import com.rush.agent.model.SessionStatus;
import com.rush.agent.model.ThreadMessage;
import com.rush.agent.model.ThreadSession;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class SessionAnalyticsService {

    private final SessionRegistry registry;
    private final Clock clock;

    public SessionAnalyticsService(SessionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public SessionMetrics getSessionMetrics(String sessionId) {
        return registry.find(sessionId)
            .map(this::metricsOf)
            .orElse(null);
    }

    public List<ThreadSession> getActiveSessions() {
        return registry.snapshot().stream()
            .filter(ThreadSession::isActive)
            .collect(Collectors.toList());
    }

    public List<ThreadSession> getSessionHistory(int limit) {
        return registry.snapshot().stream()
            .sorted(Comparator.comparing(ThreadSession::getStartTime).reversed())
            .limit(Math.max(0, limit))
            .collect(Collectors.toList());
    }

    public SessionAnalytics getAnalytics() {
        List<ThreadSession> sessions = registry.snapshot();
        Instant now = clock.instant();

        int active = 0;
        int completed = 0;
        int failed = 0;
        long totalDuration = 0;
        long totalMessages = 0;
        long successfulMessages = 0;

        for (ThreadSession session : sessions) {
            SessionStatus status = session.getStatus();
            if (status == SessionStatus.ACTIVE) {
                active++;
            } else if (status == SessionStatus.COMPLETED) {
                completed++;
            } else {
                failed++;
            }
            totalDuration += durationOf(session, now);

            List<ThreadMessage> messages = session.getMessages();
            totalMessages += messages.size();
            successfulMessages += countSuccessful(messages);
        }

        return SessionAnalytics.builder()
            .totalSessions(sessions.size())
            .activeSessions(active)
            .completedSessions(completed)
            .failedSessions(failed)
            .averageDuration(sessions.isEmpty() ? 0 : (double) totalDuration / sessions.size())
            .averageSuccessRate(totalMessages > 0 ? (double) successfulMessages / totalMessages : 0)
            .totalMessages(totalMessages)
            .build();
    }

    private SessionMetrics metricsOf(ThreadSession session) {
        List<ThreadMessage> messages = session.getMessages();
        return SessionMetrics.builder()
            .sessionId(session.getId())
            .duration(durationOf(session, clock.instant()))
            .messageCount(messages.size())
            .participantCount(session.getParticipants().size())
            .status(session.getStatus())
            .successRate(messages.isEmpty() ? 0 : (double) countSuccessful(messages) / messages.size())
            .avgResponseTime(averageResponseTime(messages))
            .build();
    }

    static double averageResponseTime(List<ThreadMessage> messages) {
        long total = 0;
        int pairs = 0;
        for (int i = 1; i < messages.size(); i++) {
            ThreadMessage previous = messages.get(i - 1);
            ThreadMessage current = messages.get(i);
            if (previous.getType() == MessageType.REQUEST && current.getType() == MessageType.RESPONSE) {
                total += Duration.between(previous.getTimestamp(), current.getTimestamp()).toMillis();
                pairs++;
            }
        }
        return pairs > 0 ? (double) total / pairs : 0;
    }

    private static long countSuccessful(List<ThreadMessage> messages) {
        return messages.stream().filter(m -> m.getType() != MessageType.ERROR).count();
    }

    private static long durationOf(ThreadSession session, Instant now) {
        Instant end = session.getEndTime() != null ? session.getEndTime() : now;
        return Duration.between(session.getStartTime(), end).toMillis();
    }
}
