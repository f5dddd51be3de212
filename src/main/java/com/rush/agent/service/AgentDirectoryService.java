package com.rush.agent.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.rush.agent.model.Agent;
import com.rush.agent.model.AgentStatus;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Slf4j
@Service
public class AgentDirectoryService {

    @Value("${rush.agents.path:config/agents}")
    private String agentsPath = "config/agents";

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public AgentDirectoryService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setAgentsPath(String path) {
        this.agentsPath = path;
    }

    @PostConstruct
    public void loadAgents() {
        agents.clear();
        File agentsDir = new File(agentsPath);

        if (agentsDir.isDirectory()) {
            File[] yamlFiles = agentsDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
            if (yamlFiles != null) {
                for (File file : yamlFiles) {
                    try {
                        Agent agent = yamlMapper.readValue(file, Agent.class);
                        if (agent.getId() != null) {
                            agents.put(agent.getId(), agent);
                            log.info("Loaded agent definition: {}", agent.getId());
                        }
                    } catch (Exception e) {
                        log.error("Failed to load agent from {}: {}", file.getName(), e.getMessage());
                    }
                }
            }
        } else {
            log.info("Agent directory not found: {}", agentsPath);
        }

        if (agents.isEmpty()) {
            defaultAgents().forEach(agent -> agents.put(agent.getId(), agent));
            log.info("Using {} built-in agent definitions", agents.size());
        }
    }

    public List<Agent> listAgents() {
        List<Agent> result = new ArrayList<>(agents.values());
        result.sort(Comparator.comparing(Agent::getId));
        return result;
    }

    public Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public List<Agent> findByCapability(String capability) {
        return listAgents().stream()
            .filter(agent -> agent.hasCapability(capability))
            .collect(Collectors.toList());
    }

    public boolean updateStatus(String agentId, AgentStatus status) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            return false;
        }
        agent.setStatus(status);
        return true;
    }

    static List<Agent> defaultAgents() {
        return List.of(
            Agent.builder()
                .id("rush-voice-listener")
                .name("RUSH Voice Listener")
                .description("Processes voice input and extracts payment intent")
                .capabilities(capabilities("speech-to-text", "intent-extraction", "voice-processing"))
                .endpoint("coral://agents/rush-voice-listener")
                .build(),
            Agent.builder()
                .id("rush-brain-agent")
                .name("RUSH Brain Agent")
                .description("Analyzes intent and coordinates multi-agent workflows")
                .capabilities(capabilities("intent-analysis", "workflow-coordination", "decision-making"))
                .endpoint("coral://agents/rush-brain-agent")
                .build(),
            Agent.builder()
                .id("rush-executor-agent")
                .name("RUSH Executor Agent")
                .description("Executes blockchain transactions and payment processing")
                .capabilities(capabilities("blockchain-execution", "payment-processing", "transaction-management"))
                .endpoint("coral://agents/rush-executor-agent")
                .build(),
            Agent.builder()
                .id("rush-fraud-detector")
                .name("RUSH Fraud Detector")
                .description("AI-powered fraud detection and risk assessment")
                .capabilities(capabilities("fraud-detection", "risk-analysis", "compliance-checking"))
                .endpoint("coral://agents/rush-fraud-detector")
                .build()
        );
    }

    private static Set<String> capabilities(String... tags) {
        return new LinkedHashSet<>(Arrays.asList(tags));
    }
}
