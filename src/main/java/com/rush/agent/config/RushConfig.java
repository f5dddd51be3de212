package com.rush.agent.config;

import com.rush.agent.transport.LocalThreadTransport;
import com.rush.agent.transport.SimulatedAgents;
import com.rush.agent.transport.SlackThreadTransport;
import com.rush.agent.transport.ThreadTransport;
import com.slack.api.Slack;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RushConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "rush.transport.mode", havingValue = "slack")
    public ThreadTransport slackThreadTransport(Clock clock) {
        return new SlackThreadTransport(Slack.getInstance(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "rush.transport.mode", havingValue = "local", matchIfMissing = true)
    public ThreadTransport localThreadTransport(
            @Value("${rush.transport.agent-id:rush-orchestrator}") String orchestratorId,
            @Value("${rush.transport.local.simulated-agents:true}") boolean simulatedAgents,
            Clock clock) {
        LocalThreadTransport transport = new LocalThreadTransport(orchestratorId, clock);
        if (simulatedAgents) {
            SimulatedAgents.registerAll(transport);
        }
        return transport;
    }
}
