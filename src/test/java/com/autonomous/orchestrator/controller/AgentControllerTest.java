package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.model.AgentStatus;
import com.autonomous.orchestrator.model.AgentStatusSnapshot;
import com.autonomous.orchestrator.model.TaskMetrics;
import com.autonomous.orchestrator.service.TaskMetricsService;
import com.autonomous.orchestrator.service.TaskOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TaskOrchestrator orchestrator;

    @MockBean
    private TaskMetricsService metricsService;

    @Test
    void shouldListAgentStatus() throws Exception {
        when(orchestrator.getAgentStatus()).thenReturn(List.of(
            new AgentStatusSnapshot("agent-aria", "Aria", AgentStatus.IDLE, List.of("research"), 2, 0.9)));

        mockMvc.perform(get("/api/agents/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.agents[0].id").value("agent-aria"))
            .andExpect(jsonPath("$.agents[0].status").value("idle"))
            .andExpect(jsonPath("$.agents[0].knowledgeBaseSize").value(2));
    }

    @Test
    void shouldReturnMetricsOfRequestingUser() throws Exception {
        when(metricsService.metricsFor("u1")).thenReturn(TaskMetrics.builder()
            .totalTasks(3).completedTasks(2).failedTasks(1).successRate("66.67").avgProcessingTime("3.00").build());

        mockMvc.perform(get("/api/agents/metrics").header(TaskController.USER_HEADER, "u1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.metrics.totalTasks").value(3))
            .andExpect(jsonPath("$.metrics.successRate").value("66.67"));
    }
}
