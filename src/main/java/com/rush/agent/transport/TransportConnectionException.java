package com.rush.agent.transport;

public class TransportConnectionException extends RuntimeException {
    public TransportConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
