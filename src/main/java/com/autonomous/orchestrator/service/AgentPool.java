package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Agent;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.AgentStatusSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fixed set of agents created once at start-up. Iteration order is by agent id.
 */
@Slf4j
public class AgentPool {

    private final Map<String, Agent> agents;

    public AgentPool(List<AgentConfig> configs) {
        Map<String, Agent> byId = new TreeMap<>();
        for (AgentConfig config : configs) {
            Agent agent = Agent.fromConfig(config);
            if (byId.putIfAbsent(agent.getId(), agent) != null) {
                throw new IllegalStateException("Duplicate agent id: " + agent.getId());
            }
            log.info("Initialized agent: {} ({})", agent.getName(), agent.getPersonality().describe());
        }
        this.agents = Collections.unmodifiableMap(byId);
    }

    public Collection<Agent> agents() {
        return agents.values();
    }

    public Optional<Agent> get(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public List<AgentStatusSnapshot> snapshot() {
        return agents.values().stream().map(Agent::snapshot).toList();
    }
}
