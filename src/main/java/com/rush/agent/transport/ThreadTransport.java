package com.rush.agent.transport;

import java.util.List;

public interface ThreadTransport {

    void connect();

    boolean isConnected();

    String createThread(String name, List<String> participantIds);

    TransportMessage sendMessage(String threadId, String content, List<String> mentions);

    /**
     * Blocks until a message addressed to the orchestrator arrives in the thread.
     *
     * @throws TransportTimeoutException if nothing arrives within {@code timeoutMs}
     */
    TransportMessage waitForMentions(String threadId, long timeoutMs);

    boolean addParticipant(String threadId, String agentId);

    // later calls on a released thread may fail; unknown threads are ignored
    void releaseThread(String threadId);
}
