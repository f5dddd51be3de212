package com.rush.agent.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.rush.agent.model.MessageType;
import com.rush.agent.model.SessionMetadata;
import com.rush.agent.model.SessionStatus;
import com.rush.agent.model.ThreadMessage;
import com.rush.agent.model.ThreadSession;
import com.rush.agent.transport.ThreadTransport;
import com.rush.agent.transport.ThreadTransportException;
import com.rush.agent.transport.TransportMessage;
import com.rush.agent.transport.TransportTimeoutException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one user query through the agent pipeline:
 * voice listener, brain, then fraud detector and executor when the query or the brain's
 * analysis calls for them. Steps run one after another on the caller's thread; each wait
 * for a reply runs on a worker as a cancellable future bounded by the step's timeout.
 *
 * <p>Any step failure ends the session as {@link SessionStatus#FAILED} with one trailing
 * error message. Callers always get the session back; its status is the outcome.
 */
@Slf4j
@Service
public class SessionOrchestratorService {

    static final List<String> SUPPORT_PARTICIPANTS = List.of(
        PipelineStage.VOICE_LISTENER.getAgentId(),
        PipelineStage.BRAIN.getAgentId(),
        PipelineStage.EXECUTOR.getAgentId(),
        PipelineStage.FRAUD_DETECTOR.getAgentId()
    );

    static final String CANCEL_NOTICE = "Session cancelled by user";

    private final ThreadTransport transport;
    private final SessionRegistry registry;
    private final SessionClassifier classifier;
    private final AgentResultInterpreter interpreter;
    private final PipelineProperties properties;
    private final Clock clock;

    private final Map<String, Future<TransportMessage>> pendingWaits = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public SessionOrchestratorService(ThreadTransport transport,
                                      SessionRegistry registry,
                                      SessionClassifier classifier,
                                      AgentResultInterpreter interpreter,
                                      PipelineProperties properties,
                                      Clock clock) {
        this.transport = transport;
        this.registry = registry;
        this.classifier = classifier;
        this.interpreter = interpreter;
        this.properties = properties;
        this.clock = clock;
    }

    public ThreadSession startSupportSession(String userQuery, String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionMetadata metadata = new SessionMetadata(
            userQuery,
            classifier.determineSessionType(userQuery),
            classifier.determinePriority(userQuery));

        ThreadSession session = new ThreadSession(sessionId, SUPPORT_PARTICIPANTS, metadata, clock.instant());
        registry.register(session);

        log.info("Starting support session {} ({}, {} priority)", sessionId,
            metadata.getSessionType().getValue(), metadata.getPriority().getValue());

        orchestrateSupport(session);
        return session;
    }

    public Optional<ThreadSession> getSession(String sessionId) {
        return registry.find(sessionId);
    }

    public boolean cancelSession(String sessionId) {
        Optional<ThreadSession> found = registry.find(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        ThreadSession session = found.get();

        ObjectNode content = JsonNodeFactory.instance.objectNode();
        content.put("event", "cancelled");
        content.put("message", CANCEL_NOTICE);
        ThreadMessage notice = ThreadMessage.builder()
            .id(newMessageId())
            .agent(ThreadMessage.SYSTEM_AGENT)
            .content(content)
            .timestamp(clock.instant())
            .type(MessageType.COORDINATION)
            .mentions(session.getParticipants())
            .build();

        if (!session.terminate(SessionStatus.FAILED, clock.instant(), notice)) {
            return false;
        }

        // notify before waking the pipeline, which releases the thread on its way out
        broadcastCancellation(session);
        Future<TransportMessage> pending = pendingWaits.get(sessionId);
        if (pending != null) {
            pending.cancel(true);
        }

        log.info("Session {} cancelled", sessionId);
        return true;
    }

    public boolean addParticipant(String sessionId, String agentId) {
        ThreadSession session = registry.find(sessionId).orElse(null);
        if (session == null || !session.isActive()) {
            return false;
        }
        if (session.getParticipants().contains(agentId)) {
            return true;
        }
        String threadId = session.getThreadId();
        if (threadId == null) {
            return false;
        }

        try {
            if (!transport.addParticipant(threadId, agentId)) {
                return false;
            }
        } catch (ThreadTransportException e) {
            log.warn("Failed to add participant {} to session {}: {}", agentId, sessionId, e.getMessage());
            return false;
        }

        boolean added = session.addParticipant(agentId);
        if (added) {
            log.info("Added participant {} to session {}", agentId, sessionId);
        }
        return added;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private void orchestrateSupport(ThreadSession session) {
        String userQuery = session.getMetadata().getUserQuery();

        try {
            String threadId = transport.createThread("support-session-" + session.getId(), session.getParticipants());
            if (!session.assignThread(threadId)) {
                throw new ThreadTransportException("transport returned no thread id");
            }

            JsonNode voiceResult = runStep(session, PipelineStage.VOICE_LISTENER, userQuery);
            JsonNode analysis = runStep(session, PipelineStage.BRAIN, interpreter.render(voiceResult));

            if (classifier.requiresFraudDetection(userQuery, interpreter.riskOf(analysis))) {
                runStep(session, PipelineStage.FRAUD_DETECTOR, interpreter.render(analysis));
            }

            if (classifier.requiresBlockchainAction(interpreter.actionOf(analysis))) {
                runStep(session, PipelineStage.EXECUTOR, interpreter.render(analysis));
            }

            if (session.terminate(SessionStatus.COMPLETED, clock.instant(), null)) {
                log.info("Support session {} completed with {} messages",
                    session.getId(), session.getMessages().size());
            }
        } catch (SessionStoppedException e) {
            log.info("Support session {} stopped: {}", session.getId(), e.getMessage());
        } catch (PipelineStepException e) {
            fail(session, e.getStage(), e.getReason(), e.getMessage());
        } catch (ThreadTransportException e) {
            fail(session, null, "transport_error", "Failed to create thread: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Support session {} hit an unexpected error", session.getId(), e);
            fail(session, null, "internal_error", String.valueOf(e.getMessage()));
        } finally {
            releaseThread(session);
        }
    }

    private JsonNode runStep(ThreadSession session, PipelineStage stage, String payload) {
        String threadId = session.getThreadId();
        String request = stage.formatRequest(payload);
        long timeoutMs = properties.timeoutFor(stage);

        boolean dispatched = session.dispatchIfActive(() -> {
            log.debug("Session {}: sending to {}", session.getId(), stage.getAgentId());
            try {
                transport.sendMessage(threadId, request, List.of(stage.getAgentId()));
            } catch (ThreadTransportException e) {
                throw new PipelineStepException(stage,
                    "Failed to send request to " + stage.getAgentId() + ": " + e.getMessage(), e);
            }
            record(session, ThreadMessage.builder()
                .id(newMessageId())
                .agent(ThreadMessage.SYSTEM_AGENT)
                .content(TextNode.valueOf(request))
                .timestamp(clock.instant())
                .type(MessageType.REQUEST)
                .mention(stage.getAgentId())
                .build());
        });
        if (!dispatched) {
            throw new SessionStoppedException("session left the active state before " + stage.getAgentId());
        }

        TransportMessage reply = awaitReply(session, stage, threadId, timeoutMs);
        JsonNode result = interpreter.parse(reply.getContent());

        record(session, ThreadMessage.builder()
            .id(newMessageId())
            .agent(stage.getAgentId())
            .content(result)
            .timestamp(clock.instant())
            .type(MessageType.RESPONSE)
            .build());
        return result;
    }

    private TransportMessage awaitReply(ThreadSession session, PipelineStage stage, String threadId, long timeoutMs) {
        Future<TransportMessage> pending = executor.submit(() -> transport.waitForMentions(threadId, timeoutMs));
        pendingWaits.put(session.getId(), pending);
        try {
            // cancelSession may have run before the wait was registered
            if (!session.isActive()) {
                pending.cancel(true);
            }
            return pending.get(timeoutMs + properties.getWaitGraceMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new StepTimeoutException(stage, timeoutMs, e);
        } catch (CancellationException e) {
            throw new SessionStoppedException("wait on " + stage.getAgentId() + " was cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportTimeoutException) {
                throw new StepTimeoutException(stage, timeoutMs, cause);
            }
            throw new PipelineStepException(stage,
                "Exchange with " + stage.getAgentId() + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new PipelineStepException(stage, "Interrupted while waiting for " + stage.getAgentId(), e);
        } finally {
            pendingWaits.remove(session.getId(), pending);
        }
    }

    private void record(ThreadSession session, ThreadMessage message) {
        if (!session.appendMessage(message)) {
            throw new SessionStoppedException("discarded " + message.getType().getValue()
                + " from " + message.getAgent() + " after session ended");
        }
    }

    private void fail(ThreadSession session, PipelineStage stage, String reason, String message) {
        ThreadMessage error = ThreadMessage.builder()
            .id(newMessageId())
            .agent(ThreadMessage.SYSTEM_AGENT)
            .content(interpreter.errorPayload(stage != null ? stage.getAgentId() : null, reason, message))
            .timestamp(clock.instant())
            .type(MessageType.ERROR)
            .build();

        if (session.terminate(SessionStatus.FAILED, clock.instant(), error)) {
            log.warn("Support session {} failed ({}): {}", session.getId(), reason, message);
        }
    }

    private void broadcastCancellation(ThreadSession session) {
        String threadId = session.getThreadId();
        if (threadId == null) {
            return;
        }
        try {
            transport.sendMessage(threadId, CANCEL_NOTICE, session.getParticipants());
        } catch (ThreadTransportException e) {
            log.warn("Could not notify participants of session {}: {}", session.getId(), e.getMessage());
        }
    }

    private void releaseThread(ThreadSession session) {
        String threadId = session.getThreadId();
        if (threadId == null) {
            return;
        }
        try {
            transport.releaseThread(threadId);
        } catch (ThreadTransportException e) {
            log.warn("Could not release thread {} of session {}: {}", threadId, session.getId(), e.getMessage());
        }
    }

    private static String newMessageId() {
        return "msg_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static final class SessionStoppedException extends RuntimeException {
        private SessionStoppedException(String message) {
            super(message);
        }
    }
}
