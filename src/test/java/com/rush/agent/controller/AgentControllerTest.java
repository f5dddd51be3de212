package com.rush.agent.controller;

import com.rush.agent.model.Agent;
import com.rush.agent.service.AgentDirectoryService;
import com.rush.agent.transport.ThreadTransport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AgentDirectoryService agentDirectory;

    @MockBean
    private ThreadTransport transport;

    @Test
    void shouldFilterAgentsByCapability() throws Exception {
        when(agentDirectory.findByCapability("fraud-detection")).thenReturn(List.of(
            Agent.builder().id("rush-fraud-detector").capabilities(Set.of("fraud-detection")).build()));

        mockMvc.perform(get("/api/agents").param("capability", "fraud-detection"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("rush-fraud-detector"))
            .andExpect(jsonPath("$[0].status").value("active"));

        verify(agentDirectory, never()).listAgents();
    }

    @Test
    void shouldReturnNotFoundForUnknownAgent() throws Exception {
        when(agentDirectory.getAgent("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/agents/ghost")).andExpect(status().isNotFound());
    }

    @Test
    void shouldReportHealth() throws Exception {
        when(transport.isConnected()).thenReturn(true);

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.transportConnected").value(true));
    }
}
