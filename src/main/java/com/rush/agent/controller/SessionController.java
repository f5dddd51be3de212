package com.rush.agent.controller;

import com.rush.agent.model.SessionMetrics;
import com.rush.agent.model.ThreadSession;
import com.rush.agent.service.SessionAnalyticsService;
import com.rush.agent.service.SessionOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionOrchestratorService orchestrator;
    private final SessionAnalyticsService analytics;

    public SessionController(SessionOrchestratorService orchestrator, SessionAnalyticsService analytics) {
        this.orchestrator = orchestrator;
        this.analytics = analytics;
    }

    @PostMapping
    public ResponseEntity<?> startSession(@RequestBody Map<String, String> body) {
        String query = body.get("query");
        if (query == null || query.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "query is required"));
        }
        String sessionId = body.get("sessionId");
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = "session_" + UUID.randomUUID().toString().substring(0, 8);
        }

        ThreadSession session = orchestrator.startSupportSession(query, sessionId);
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<?> getSession(@PathVariable String sessionId) {
        return orchestrator.getSession(sessionId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{sessionId}/metrics")
    public ResponseEntity<?> getMetrics(@PathVariable String sessionId) {
        SessionMetrics metrics = analytics.getSessionMetrics(sessionId);
        if (metrics == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(metrics);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> cancelSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("cancelled", orchestrator.cancelSession(sessionId)));
    }

    @PostMapping("/{sessionId}/participants")
    public ResponseEntity<?> addParticipant(@PathVariable String sessionId, @RequestBody Map<String, String> body) {
        String agentId = body.get("agentId");
        if (agentId == null || agentId.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "agentId is required"));
        }
        return ResponseEntity.ok(Map.of("added", orchestrator.addParticipant(sessionId, agentId)));
    }

    @GetMapping("/active")
    public ResponseEntity<?> activeSessions() {
        return ResponseEntity.ok(analytics.getActiveSessions());
    }

    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(analytics.getSessionHistory(limit));
    }

    @GetMapping("/analytics")
    public ResponseEntity<?> analytics() {
        return ResponseEntity.ok(analytics.getAnalytics());
    }
}
