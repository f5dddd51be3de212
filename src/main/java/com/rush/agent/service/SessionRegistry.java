package com.rush.agent.service;

import com.rush.agent.model.ThreadSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide store of sessions, bounded by {@code rush.registry.max-sessions}.
 * When full, the oldest finished session is evicted to make room. Active sessions
 * are never evicted, so the bound can be exceeded while all of them are in flight.
 */
@Slf4j
@Component
public class SessionRegistry {

    @Value("${rush.registry.max-sessions:1000}")
    private int maxSessions = 1000;

    private final Map<String, ThreadSession> sessions = new LinkedHashMap<>();

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }

    public synchronized void register(ThreadSession session) {
        if (sessions.containsKey(session.getId())) {
            throw new DuplicateSessionException(session.getId());
        }
        evictIfFull();
        sessions.put(session.getId(), session);
    }

    public synchronized Optional<ThreadSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public synchronized List<ThreadSession> snapshot() {
        return new ArrayList<>(sessions.values());
    }

    public synchronized int size() {
        return sessions.size();
    }

    private void evictIfFull() {
        Iterator<ThreadSession> oldestFirst = sessions.values().iterator();
        while (sessions.size() >= maxSessions && oldestFirst.hasNext()) {
            ThreadSession candidate = oldestFirst.next();
            if (!candidate.isActive()) {
                oldestFirst.remove();
                log.debug("Evicted session {} ({})", candidate.getId(), candidate.getStatus().getValue());
            }
        }
    }
}
