package com.rush.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {
    private String id;
    private String name;
    private String description;
    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();
    private String endpoint;
    @Builder.Default
    private AgentStatus status = AgentStatus.ACTIVE;

    public boolean hasCapability(String capability) {
        return capabilities != null && capabilities.contains(capability);
    }
}
