package com.rush.agent.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ThreadSessionTest {

    private static final Instant START = Instant.parse("2025-09-18T10:00:00Z");

    private ThreadSession session;

    @BeforeEach
    void setUp() {
        session = new ThreadSession("s1", List.of("a", "b"),
            new SessionMetadata("hello", SessionType.VOICE_SUPPORT, Priority.LOW), START);
    }

    @Test
    void shouldStartActiveWithoutEndTime() {
        assertEquals(SessionStatus.ACTIVE, session.getStatus());
        assertTrue(session.isActive());
        assertNull(session.getEndTime());
        assertTrue(session.getMessages().isEmpty());
    }

    @Test
    void shouldAssignThreadOnlyOnce() {
        assertTrue(session.assignThread("t1"));
        assertFalse(session.assignThread("t2"));
        assertEquals("t1", session.getThreadId());
    }

    @Test
    void shouldFreezeAfterTerminalTransition() {
        Instant end = START.plusSeconds(5);
        assertTrue(session.terminate(SessionStatus.COMPLETED, end, null));

        assertFalse(session.terminate(SessionStatus.FAILED, end.plusSeconds(1), message(MessageType.ERROR, end)));
        assertFalse(session.appendMessage(message(MessageType.RESPONSE, end)));
        assertFalse(session.addParticipant("c"));

        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertEquals(end, session.getEndTime());
        assertTrue(session.getMessages().isEmpty());
        assertEquals(List.of("a", "b"), session.getParticipants());
    }

    @Test
    void shouldAppendTrailingMessageWithTerminalTransition() {
        Instant at = START.plusSeconds(2);
        assertTrue(session.terminate(SessionStatus.FAILED, at, message(MessageType.ERROR, at)));

        assertEquals(1, session.getMessages().size());
        assertEquals(MessageType.ERROR, session.getMessages().get(0).getType());
        assertEquals(at, session.getEndTime());
    }

    @Test
    void shouldRejectNonTerminalTarget() {
        assertThrows(IllegalArgumentException.class,
            () -> session.terminate(SessionStatus.ACTIVE, START, null));
    }

    @Test
    void shouldKeepTimestampsNonDecreasing() {
        session.appendMessage(message(MessageType.REQUEST, START.plusSeconds(10)));
        session.appendMessage(message(MessageType.RESPONSE, START.plusSeconds(3)));
        session.terminate(SessionStatus.COMPLETED, START.plusSeconds(1), null);

        List<ThreadMessage> messages = session.getMessages();
        assertEquals(START.plusSeconds(10), messages.get(1).getTimestamp());
        assertFalse(session.getEndTime().isBefore(messages.get(1).getTimestamp()));
    }

    @Test
    void shouldOnlyGrowParticipants() {
        assertTrue(session.addParticipant("c"));
        assertTrue(session.addParticipant("a"));

        assertEquals(List.of("a", "b", "c"), session.getParticipants());
    }

    @Test
    void shouldExposeDefensiveCopies() {
        session.appendMessage(message(MessageType.REQUEST, START));

        assertThrows(UnsupportedOperationException.class, () -> session.getMessages().clear());
        assertThrows(UnsupportedOperationException.class, () -> session.getParticipants().add("x"));
    }

    @Test
    void shouldNotLetCallersRewriteAppendedContent() {
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        content.put("transcription", "Send $1000 to Philippines");
        session.appendMessage(ThreadMessage.builder()
            .id("m1")
            .agent("rush-voice-listener")
            .content(content)
            .timestamp(START)
            .type(MessageType.RESPONSE)
            .build());

        content.put("transcription", "changed by sender");
        ((ObjectNode) session.getMessages().get(0).getContent()).put("transcription", "changed by reader");

        assertEquals("Send $1000 to Philippines",
            session.getMessages().get(0).getContent().get("transcription").asText());
    }

    @Test
    void shouldNotDispatchAfterTermination() {
        session.terminate(SessionStatus.FAILED, START, null);
        AtomicBoolean ran = new AtomicBoolean();

        assertFalse(session.dispatchIfActive(() -> ran.set(true)));
        assertFalse(ran.get());
    }

    @Test
    void shouldHoldTerminationUntilRunningDispatchReturns() throws Exception {
        CountDownLatch dispatching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> dispatch = pool.submit(() -> session.dispatchIfActive(() -> {
                dispatching.countDown();
                awaitQuietly(release);
                session.appendMessage(message(MessageType.REQUEST, START.plusSeconds(1)));
            }));
            assertTrue(dispatching.await(5, TimeUnit.SECONDS));

            Future<Boolean> terminate = pool.submit(() -> session.terminate(SessionStatus.FAILED, START, null));
            Thread.sleep(100);
            assertFalse(terminate.isDone());
            assertTrue(session.isActive());

            release.countDown();
            assertTrue(dispatch.get(5, TimeUnit.SECONDS));
            assertTrue(terminate.get(5, TimeUnit.SECONDS));
            assertEquals(SessionStatus.FAILED, session.getStatus());
            assertEquals(1, session.getMessages().size());
        } finally {
            pool.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ThreadMessage message(MessageType type, Instant at) {
        return ThreadMessage.builder()
            .id("m-" + at.toEpochMilli())
            .agent(ThreadMessage.SYSTEM_AGENT)
            .content(TextNode.valueOf("x"))
            .timestamp(at)
            .type(type)
            .build();
    }
}
