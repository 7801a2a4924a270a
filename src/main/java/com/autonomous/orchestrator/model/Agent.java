package com.autonomous.orchestrator.model;

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A worker of the pool. Identity and traits are fixed at start-up; status, the held task
 * and the knowledge map change while tasks are processed.
 * <p>
 * Status and current task live in a single atomic reference so an agent can never be
 * observed busy with one task and assigned another.
 */
@Getter
public class Agent {

    private final String id;
    private final String name;
    private final Personality personality;
    private final List<String> specialization;
    private final double curiosityLevel;
    private final double learningRate;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, KnowledgeEntry> knowledgeBase = new ConcurrentHashMap<>();

    public Agent(String id, String name, Personality personality, List<String> specialization,
                 double curiosityLevel, double learningRate) {
        this.id = id;
        this.name = name;
        this.personality = personality;
        this.specialization = List.copyOf(specialization);
        this.curiosityLevel = curiosityLevel;
        this.learningRate = learningRate;
    }

    public static Agent fromConfig(AgentConfig config) {
        return new Agent(
            "agent-" + config.getName().toLowerCase(Locale.ROOT),
            config.getName(),
            new Personality(config.getPersonality()),
            config.getSpecialization(),
            config.getCuriosityLevel(),
            config.getLearningRate()
        );
    }

    public AgentStatus getStatus() {
        return state.get().status();
    }

    public String getCurrentTask() {
        return state.get().taskId();
    }

    public boolean isIdle() {
        return getStatus() == AgentStatus.IDLE;
    }

    /**
     * Claims this agent for a task. Succeeds only from IDLE.
     */
    public boolean tryAssign(String taskId) {
        State current = state.get();
        if (current.status() != AgentStatus.IDLE) {
            return false;
        }
        return state.compareAndSet(current, new State(AgentStatus.BUSY, taskId));
    }

    public boolean startLearning() {
        State current = state.get();
        if (current.status() != AgentStatus.BUSY) {
            return false;
        }
        return state.compareAndSet(current, new State(AgentStatus.LEARNING, current.taskId()));
    }

    public boolean finishLearning() {
        State current = state.get();
        if (current.status() != AgentStatus.LEARNING) {
            return false;
        }
        return state.compareAndSet(current, new State(AgentStatus.BUSY, current.taskId()));
    }

    public void release() {
        state.set(State.IDLE);
    }

    public void learn(KnowledgeItem item, Instant now) {
        knowledgeBase.put(item.key(), KnowledgeEntry.ingest(item, now));
    }

    public Map<String, KnowledgeEntry> getKnowledgeBase() {
        return Map.copyOf(knowledgeBase);
    }

    public int getKnowledgeBaseSize() {
        return knowledgeBase.size();
    }

    public AgentStatusSnapshot snapshot() {
        return new AgentStatusSnapshot(id, name, getStatus(), specialization, knowledgeBase.size(), curiosityLevel);
    }

    private record State(AgentStatus status, String taskId) {
        static final State IDLE = new State(AgentStatus.IDLE, null);
    }
}
