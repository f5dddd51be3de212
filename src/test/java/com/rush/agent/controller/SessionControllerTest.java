package com.rush.agent.controller;

import com.rush.agent.model.Priority;
import com.rush.agent.model.SessionAnalytics;
import com.rush.agent.model.SessionMetadata;
import com.rush.agent.model.SessionMetrics;
import com.rush.agent.model.SessionStatus;
import com.rush.agent.model.SessionType;
import com.rush.agent.model.ThreadSession;
import com.rush.agent.service.DuplicateSessionException;
import com.rush.agent.service.SessionAnalyticsService;
import com.rush.agent.service.SessionOrchestratorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SessionOrchestratorService orchestrator;

    @MockBean
    private SessionAnalyticsService analytics;

    @Test
    void shouldStartSessionWithGivenId() throws Exception {
        ThreadSession session = session("s1");
        session.terminate(SessionStatus.COMPLETED, Instant.parse("2025-09-18T12:00:05Z"), null);
        when(orchestrator.startSupportSession("Send $1000 to Philippines", "s1")).thenReturn(session);

        mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"Send $1000 to Philippines\",\"sessionId\":\"s1\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("s1"))
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.metadata.sessionType").value("voice_support"))
            .andExpect(jsonPath("$.participants.length()").value(2));
    }

    @Test
    void shouldGenerateSessionIdWhenMissing() throws Exception {
        when(orchestrator.startSupportSession(eq("hello"), startsWith("session_"))).thenReturn(session("session_x"));

        mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"hello\"}"))
            .andExpect(status().isCreated());

        verify(orchestrator).startSupportSession(eq("hello"), startsWith("session_"));
    }

    @Test
    void shouldRejectBlankQuery() throws Exception {
        mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("query is required"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldReturnConflictForDuplicateId() throws Exception {
        when(orchestrator.startSupportSession("hello", "s1")).thenThrow(new DuplicateSessionException("s1"));

        mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"hello\",\"sessionId\":\"s1\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("DUPLICATE_SESSION"));
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() throws Exception {
        when(orchestrator.getSession("missing")).thenReturn(Optional.empty());
        when(analytics.getSessionMetrics("missing")).thenReturn(null);

        mockMvc.perform(get("/api/sessions/missing")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/sessions/missing/metrics")).andExpect(status().isNotFound());
    }

    @Test
    void shouldReturnSessionMetrics() throws Exception {
        when(analytics.getSessionMetrics("s1")).thenReturn(SessionMetrics.builder()
            .sessionId("s1")
            .duration(5000)
            .messageCount(4)
            .participantCount(4)
            .status(SessionStatus.ACTIVE)
            .successRate(1.0)
            .avgResponseTime(250.0)
            .build());

        mockMvc.perform(get("/api/sessions/s1/metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.messageCount").value(4))
            .andExpect(jsonPath("$.status").value("active"))
            .andExpect(jsonPath("$.avgResponseTime").value(250.0));
    }

    @Test
    void shouldCancelSession() throws Exception {
        when(orchestrator.cancelSession("s1")).thenReturn(true);

        mockMvc.perform(delete("/api/sessions/s1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    void shouldAddParticipant() throws Exception {
        when(orchestrator.addParticipant("s1", "rush-compliance-agent")).thenReturn(false);

        mockMvc.perform(post("/api/sessions/s1/participants")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"agentId\":\"rush-compliance-agent\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.added").value(false));
    }

    @Test
    void shouldListHistoryAndAnalytics() throws Exception {
        when(analytics.getSessionHistory(2)).thenReturn(List.of(session("s2"), session("s1")));
        when(analytics.getAnalytics()).thenReturn(SessionAnalytics.builder()
            .totalSessions(2)
            .activeSessions(2)
            .build());

        mockMvc.perform(get("/api/sessions/history").param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("s2"));
        mockMvc.perform(get("/api/sessions/analytics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalSessions").value(2));
    }

    private static ThreadSession session(String id) {
        return new ThreadSession(id, List.of("rush-voice-listener", "rush-brain-agent"),
            new SessionMetadata("Send $1000 to Philippines", SessionType.VOICE_SUPPORT, Priority.LOW),
            Instant.parse("2025-09-18T12:00:00Z"));
    }
}
