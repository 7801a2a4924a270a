package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Agent;
import com.autonomous.orchestrator.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the idle agent that best fits a task and claims it.
 * <p>
 * Score is {@code 0.3 * curiosity + 0.2 * learningRate + 0.5 * matches}, where a specialization
 * tag matches when any lowercase prompt token is a substring of it. Highest score wins; equal
 * scores go to the lowest agent id.
 */
@Slf4j
@Service
public class AgentSelector {

    static final double CURIOSITY_WEIGHT = 0.3;
    static final double LEARNING_RATE_WEIGHT = 0.2;
    static final double SPECIALIZATION_WEIGHT = 0.5;

    private final AgentPool agentPool;

    public AgentSelector(AgentPool agentPool) {
        this.agentPool = agentPool;
    }

    public Optional<Agent> selectAgent(Task task) {
        List<Agent> ranked = rank(task);
        for (Agent candidate : ranked) {
            if (candidate.tryAssign(task.getId())) {
                log.debug("Selected agent {} for task {}", candidate.getName(), task.getId());
                return Optional.of(candidate);
            }
            // lost the race to another processing attempt, try the next one
        }
        return Optional.empty();
    }

    /**
     * Idle agents, best first.
     */
    public List<Agent> rank(Task task) {
        List<String> keywords = keywords(task.getPrompt());
        Comparator<Agent> byScore = Comparator.comparingDouble(agent -> score(agent, keywords));
        return agentPool.agents().stream()
            .filter(Agent::isIdle)
            .sorted(byScore.reversed().thenComparing(Agent::getId))
            .toList();
    }

    public double score(Agent agent, Task task) {
        return score(agent, keywords(task.getPrompt()));
    }

    private double score(Agent agent, List<String> keywords) {
        double score = agent.getCuriosityLevel() * CURIOSITY_WEIGHT
            + agent.getLearningRate() * LEARNING_RATE_WEIGHT;
        for (String specialization : agent.getSpecialization()) {
            String tag = specialization.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(tag::contains)) {
                score += SPECIALIZATION_WEIGHT;
            }
        }
        return score;
    }

    static List<String> keywords(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return List.of();
        }
        return Arrays.stream(prompt.toLowerCase(Locale.ROOT).trim().split("\\s+"))
            .filter(token -> !token.isEmpty())
            .toList();
    }
}
