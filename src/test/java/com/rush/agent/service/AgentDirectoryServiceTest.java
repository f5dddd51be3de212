package com.rush.agent.service;

import com.rush.agent.model.Agent;
import com.rush.agent.model.AgentStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AgentDirectoryServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldFallBackToBuiltInAgents() {
        AgentDirectoryService directory = new AgentDirectoryService();
        directory.setAgentsPath(tempDir.resolve("missing").toString());

        directory.loadAgents();

        assertEquals(List.of("rush-brain-agent", "rush-executor-agent", "rush-fraud-detector", "rush-voice-listener"),
            directory.listAgents().stream().map(Agent::getId).collect(Collectors.toList()));
        assertEquals(AgentStatus.ACTIVE, directory.getAgent("rush-brain-agent").orElseThrow().getStatus());
    }

    @Test
    void shouldLoadAgentsFromYaml() throws Exception {
        Files.writeString(tempDir.resolve("compliance.yaml"),
            "id: rush-compliance-agent\n"
                + "name: RUSH Compliance Agent\n"
                + "description: Sanctions screening\n"
                + "capabilities:\n"
                + "  - compliance-checking\n"
                + "  - sanctions-screening\n"
                + "  - compliance-checking\n"
                + "endpoint: coral://agents/rush-compliance-agent\n"
                + "status: busy\n");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        AgentDirectoryService directory = new AgentDirectoryService();
        directory.setAgentsPath(tempDir.toString());
        directory.loadAgents();

        assertEquals(1, directory.listAgents().size());
        Agent agent = directory.getAgent("rush-compliance-agent").orElseThrow();
        assertEquals("RUSH Compliance Agent", agent.getName());
        assertEquals(AgentStatus.BUSY, agent.getStatus());
        assertEquals(Set.of("compliance-checking", "sanctions-screening"), agent.getCapabilities());
        assertEquals(List.of(agent), directory.findByCapability("sanctions-screening"));
    }

    @Test
    void shouldSkipMalformedDefinitions() throws Exception {
        Files.writeString(tempDir.resolve("broken.yaml"), "id: [unclosed");
        Files.writeString(tempDir.resolve("ok.yml"), "id: rush-ok\nname: OK\n");

        AgentDirectoryService directory = new AgentDirectoryService();
        directory.setAgentsPath(tempDir.toString());
        directory.loadAgents();

        assertEquals(List.of("rush-ok"),
            directory.listAgents().stream().map(Agent::getId).collect(Collectors.toList()));
    }

    @Test
    void shouldFindAgentsByCapabilityAndUpdateStatus() {
        AgentDirectoryService directory = new AgentDirectoryService();
        directory.setAgentsPath(tempDir.resolve("missing").toString());
        directory.loadAgents();

        assertEquals(List.of("rush-fraud-detector"), directory.findByCapability("risk-analysis").stream()
            .map(Agent::getId).collect(Collectors.toList()));
        assertTrue(directory.findByCapability("teleportation").isEmpty());

        assertTrue(directory.updateStatus("rush-executor-agent", AgentStatus.INACTIVE));
        assertEquals(AgentStatus.INACTIVE, directory.getAgent("rush-executor-agent").orElseThrow().getStatus());
        assertFalse(directory.updateStatus("ghost", AgentStatus.INACTIVE));
    }
}
