package com.rush.agent.transport;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

// startup only; per-call failures are not retried here
@Slf4j
@Component
public class TransportConnector {

    @Value("${rush.transport.connect.max-attempts:5}")
    private int maxAttempts = 5;

    @Value("${rush.transport.connect.retry-delay-ms:5000}")
    private long retryDelayMs = 5000;

    private final ThreadTransport transport;

    public TransportConnector(ThreadTransport transport) {
        this.transport = transport;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    @PostConstruct
    public void connectWithRetry() {
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                transport.connect();
                log.info("Connected to thread transport on attempt {}", attempt);
                return;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Connection attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                pause();
            }
        }

        throw new TransportConnectionException(
            "Failed to connect to thread transport after " + maxAttempts + " attempts", lastFailure);
    }

    private void pause() {
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportConnectionException("Interrupted while connecting to thread transport", e);
        }
    }
}
