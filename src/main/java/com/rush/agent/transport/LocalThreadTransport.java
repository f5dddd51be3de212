package com.rush.agent.transport;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

@Slf4j
public class LocalThreadTransport implements ThreadTransport {

    private final String orchestratorId;
    private final Clock clock;
    private final Map<String, AgentResponder> responders = new ConcurrentHashMap<>();
    private final Map<String, LocalThread> threads = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    private volatile boolean connected;

    public LocalThreadTransport(String orchestratorId, Clock clock) {
        this.orchestratorId = orchestratorId;
        this.clock = clock;
    }

    public void registerResponder(String agentId, AgentResponder responder) {
        responders.put(agentId, responder);
    }

    @Override
    public void connect() {
        connected = true;
        log.info("Local thread transport ready with {} responders", responders.size());
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String createThread(String name, List<String> participantIds) {
        requireConnected();
        String threadId = "thread_" + UUID.randomUUID().toString().substring(0, 8);
        threads.put(threadId, new LocalThread(participantIds));
        log.debug("Created thread {} ({}) with {}", threadId, name, participantIds);
        return threadId;
    }

    @Override
    public TransportMessage sendMessage(String threadId, String content, List<String> mentions) {
        LocalThread thread = requireThread(threadId);
        TransportMessage message = newMessage(threadId, orchestratorId, content,
            mentions != null ? mentions : List.of());
        thread.history.add(message);

        for (String mention : message.getMentions()) {
            AgentResponder responder = responders.get(mention);
            if (responder != null) {
                executor.submit(() -> deliver(thread, threadId, mention, responder, message));
            }
        }
        return message;
    }

    @Override
    public TransportMessage waitForMentions(String threadId, long timeoutMs) {
        LocalThread thread = requireThread(threadId);
        try {
            TransportMessage reply = thread.inbox.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (reply == null) {
                throw new TransportTimeoutException(threadId, timeoutMs);
            }
            return reply;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThreadTransportException("Interrupted while waiting on thread " + threadId, e);
        }
    }

    @Override
    public boolean addParticipant(String threadId, String agentId) {
        requireThread(threadId).participants.add(agentId);
        return true;
    }

    @Override
    public void releaseThread(String threadId) {
        if (threads.remove(threadId) != null) {
            log.debug("Released thread {}", threadId);
        }
    }

    public boolean hasThread(String threadId) {
        return threads.containsKey(threadId);
    }

    public TransportMessage postReply(String threadId, String agentId, String content) {
        LocalThread thread = requireThread(threadId);
        TransportMessage reply = newMessage(threadId, agentId, content, List.of(orchestratorId));
        thread.history.add(reply);
        thread.inbox.offer(reply);
        return reply;
    }

    public List<TransportMessage> getHistory(String threadId) {
        return new ArrayList<>(requireThread(threadId).history);
    }

    public Set<String> getParticipants(String threadId) {
        return Set.copyOf(requireThread(threadId).participants);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        connected = false;
    }

    private void deliver(LocalThread thread, String threadId, String agentId,
                         AgentResponder responder, TransportMessage request) {
        try {
            Optional<String> reply = responder.respond(request);
            reply.ifPresent(content -> {
                TransportMessage message = newMessage(threadId, agentId, content, List.of(orchestratorId));
                thread.history.add(message);
                thread.inbox.offer(message);
            });
        } catch (RuntimeException e) {
            log.warn("Responder {} failed on thread {}: {}", agentId, threadId, e.getMessage());
        }
    }

    private TransportMessage newMessage(String threadId, String agentId, String content, List<String> mentions) {
        return TransportMessage.builder()
            .id("msg_" + UUID.randomUUID().toString().substring(0, 8))
            .threadId(threadId)
            .agentId(agentId)
            .content(content)
            .timestamp(clock.instant())
            .mentions(new ArrayList<>(mentions))
            .build();
    }

    private void requireConnected() {
        if (!connected) {
            throw new ThreadTransportException("Local transport is not connected");
        }
    }

    private LocalThread requireThread(String threadId) {
        requireConnected();
        LocalThread thread = threads.get(threadId);
        if (thread == null) {
            throw new ThreadTransportException("Unknown thread: " + threadId);
        }
        return thread;
    }

    private static final class LocalThread {
        private final Set<String> participants = ConcurrentHashMap.newKeySet();
        private final List<TransportMessage> history = new CopyOnWriteArrayList<>();
        private final BlockingQueue<TransportMessage> inbox = new LinkedBlockingQueue<>();

        private LocalThread(List<String> participantIds) {
            this.participants.addAll(participantIds);
        }
    }
}
