package com.rush.agent.transport;

import lombok.Getter;

@Getter
public class TransportTimeoutException extends ThreadTransportException {

    private final String threadId;
    private final long timeoutMs;

    public TransportTimeoutException(String threadId, long timeoutMs) {
        super(String.format("No mention received in thread %s within %d ms", threadId, timeoutMs));
        this.threadId = threadId;
        this.timeoutMs = timeoutMs;
    }
}
