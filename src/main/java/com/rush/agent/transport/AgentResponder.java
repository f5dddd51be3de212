package com.rush.agent.transport;

import java.util.Optional;

@FunctionalInterface
public interface AgentResponder {
    Optional<String> respond(TransportMessage request);
}
