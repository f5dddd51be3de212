package com.rush.agent.transport;

public class ThreadTransportException extends RuntimeException {
    public ThreadTransportException(String message) {
        super(message);
    }

    public ThreadTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
