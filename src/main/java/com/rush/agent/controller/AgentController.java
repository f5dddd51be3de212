package com.rush.agent.controller;

import com.rush.agent.service.AgentDirectoryService;
import com.rush.agent.transport.ThreadTransport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class AgentController {

    private final AgentDirectoryService agentDirectory;
    private final ThreadTransport transport;

    public AgentController(AgentDirectoryService agentDirectory, ThreadTransport transport) {
        this.agentDirectory = agentDirectory;
        this.transport = transport;
    }

    @GetMapping("/agents")
    public ResponseEntity<?> listAgents(@RequestParam(required = false) String capability) {
        if (capability != null && !capability.isBlank()) {
            return ResponseEntity.ok(agentDirectory.findByCapability(capability));
        }
        return ResponseEntity.ok(agentDirectory.listAgents());
    }

    @GetMapping("/agents/{agentId}")
    public ResponseEntity<?> getAgent(@PathVariable String agentId) {
        return agentDirectory.getAgent(agentId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "healthy",
            "transportConnected", transport.isConnected()
        ));
    }
}
