package com.rush.agent.service;

public class DuplicateSessionException extends RuntimeException {
    public DuplicateSessionException(String sessionId) {
        super("Session already exists: " + sessionId);
    }
}
