package com.rush.agent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One end-to-end support interaction.
 *
 * <p>The session starts {@link SessionStatus#ACTIVE} and moves exactly once into
 * {@link SessionStatus#COMPLETED} or {@link SessionStatus#FAILED}. After that the
 * session is read-only: appends, participant additions and further transitions are
 * refused. Messages are append-only and their timestamps never go backwards.
 */
public class ThreadSession {

    @Getter
    private final String id;
    @Getter
    private final SessionMetadata metadata;
    @Getter
    private final Instant startTime;

    private final Set<String> participants;
    private final List<ThreadMessage> messages = new ArrayList<>();

    // held across a dispatch and by terminate; always taken before the session monitor
    private final Object dispatchLock = new Object();

    private String threadId;
    private SessionStatus status = SessionStatus.ACTIVE;
    private Instant endTime;

    public ThreadSession(String id, Collection<String> participants, SessionMetadata metadata, Instant startTime) {
        this.id = id;
        this.participants = new LinkedHashSet<>(participants);
        this.metadata = metadata;
        this.startTime = startTime;
    }

    public synchronized String getThreadId() {
        return threadId;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized List<String> getParticipants() {
        return List.copyOf(participants);
    }

    public synchronized List<ThreadMessage> getMessages() {
        return messages.stream()
            .map(ThreadSession::detached)
            .collect(Collectors.toUnmodifiableList());
    }

    @JsonIgnore
    public synchronized boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    // only the first non-null thread id sticks
    public synchronized boolean assignThread(String threadId) {
        if (this.threadId != null || threadId == null) {
            return false;
        }
        this.threadId = threadId;
        return true;
    }

    public synchronized boolean addParticipant(String agentId) {
        if (!isActive()) {
            return false;
        }
        participants.add(agentId);
        return true;
    }

    public synchronized boolean appendMessage(ThreadMessage message) {
        if (!isActive()) {
            return false;
        }
        messages.add(ordered(detached(message)));
        return true;
    }

    /**
     * Runs {@code dispatch} only if the session is still active. A concurrent
     * {@link #terminate} waits for a running dispatch to return, so once a session has
     * ended nothing more is dispatched for it.
     *
     * @return false if the session had already ended and {@code dispatch} was not run
     */
    public boolean dispatchIfActive(Runnable dispatch) {
        synchronized (dispatchLock) {
            if (!isActive()) {
                return false;
            }
            dispatch.run();
            return true;
        }
    }

    /**
     * Moves the session into a terminal state, optionally appending a trailing message
     * in the same step.
     *
     * @return false if the session was already terminal; nothing is changed in that case
     */
    public boolean terminate(SessionStatus terminalStatus, Instant at, ThreadMessage trailing) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        synchronized (dispatchLock) {
            synchronized (this) {
                if (!isActive()) {
                    return false;
                }
                if (trailing != null) {
                    messages.add(ordered(detached(trailing)));
                }
                status = terminalStatus;
                endTime = latest(at);
                return true;
            }
        }
    }

    private static ThreadMessage detached(ThreadMessage message) {
        if (message.getContent() == null) {
            return message;
        }
        return message.toBuilder().content(message.getContent().deepCopy()).build();
    }

    private ThreadMessage ordered(ThreadMessage message) {
        Instant adjusted = latest(message.getTimestamp());
        if (adjusted.equals(message.getTimestamp())) {
            return message;
        }
        return message.toBuilder().timestamp(adjusted).build();
    }

    // wall clock can step backwards; keep the trail monotonic
    private Instant latest(Instant candidate) {
        Instant floor = messages.isEmpty() ? startTime : messages.get(messages.size() - 1).getTimestamp();
        if (candidate == null || candidate.isBefore(floor)) {
            return floor;
        }
        return candidate;
    }
}
