package com.autonomous.orchestrator.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class AgentTest {

    private Agent agent;

    @BeforeEach
    void setUp() {
        agent = new Agent("agent-aria", "Aria", Personality.of("curious", "analytical", "thorough"),
            List.of("research", "analysis"), 0.9, 0.8);
    }

    @Test
    void shouldDeriveIdIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            AgentConfig config = new AgentConfig();
            config.setName("IRIS");
            config.setPersonality(List.of("calm"));
            config.setSpecialization(List.of("research"));
            config.setCuriosityLevel(0.5);
            config.setLearningRate(0.5);

            assertEquals("agent-iris", Agent.fromConfig(config).getId());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void shouldStartIdleWithoutTask() {
        assertEquals(AgentStatus.IDLE, agent.getStatus());
        assertNull(agent.getCurrentTask());
    }

    @Test
    void shouldAssignOnlyOnce() {
        assertTrue(agent.tryAssign("task-1"));
        assertFalse(agent.tryAssign("task-2"));

        assertEquals(AgentStatus.BUSY, agent.getStatus());
        assertEquals("task-1", agent.getCurrentTask());
    }

    @Test
    void shouldKeepTaskWhileLearning() {
        agent.tryAssign("task-1");

        assertTrue(agent.startLearning());
        assertEquals(AgentStatus.LEARNING, agent.getStatus());
        assertEquals("task-1", agent.getCurrentTask());
        assertFalse(agent.tryAssign("task-2"));

        assertTrue(agent.finishLearning());
        assertEquals(AgentStatus.BUSY, agent.getStatus());
    }

    @Test
    void shouldNotLearnWhenIdle() {
        assertFalse(agent.startLearning());
        assertEquals(AgentStatus.IDLE, agent.getStatus());
    }

    @Test
    void shouldClearTaskOnRelease() {
        agent.tryAssign("task-1");
        agent.release();

        assertEquals(AgentStatus.IDLE, agent.getStatus());
        assertNull(agent.getCurrentTask());
        assertTrue(agent.tryAssign("task-2"));
    }

    @Test
    void shouldDefaultMissingConfidence() {
        KnowledgeItem item = KnowledgeItem.builder().query("What is entropy?").topic("Entropy").content("...").build();

        agent.learn(item, Instant.parse("2024-05-01T10:00:00Z"));

        KnowledgeEntry entry = agent.getKnowledgeBase().get("Entropy");
        assertEquals(0.8, entry.getConfidence(), 1e-9);
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), entry.getIngestedAt());
        assertEquals(1, agent.getKnowledgeBaseSize());
    }

    @Test
    void shouldKeyByQueryWhenTopicMissing() {
        KnowledgeItem item = KnowledgeItem.builder().query("What is entropy?").topic(" ").confidence(0.6).build();

        agent.learn(item, Instant.now());

        assertTrue(agent.getKnowledgeBase().containsKey("What is entropy?"));
        assertEquals(0.6, agent.getKnowledgeBase().get("What is entropy?").getConfidence(), 1e-9);
    }

    @Test
    void shouldBuildIdFromConfigName() {
        AgentConfig config = new AgentConfig();
        config.setName("Zephyr");
        config.setPersonality(List.of("creative"));
        config.setSpecialization(List.of("ideation"));
        config.setCuriosityLevel(0.95);
        config.setLearningRate(0.7);

        Agent zephyr = Agent.fromConfig(config);

        assertEquals("agent-zephyr", zephyr.getId());
        assertEquals(List.of("creative"), zephyr.getPersonality().traits());
    }
}
