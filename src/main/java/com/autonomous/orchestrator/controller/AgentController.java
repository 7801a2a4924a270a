package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.service.TaskMetricsService;
import com.autonomous.orchestrator.service.TaskOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final TaskOrchestrator orchestrator;
    private final TaskMetricsService metricsService;

    public AgentController(TaskOrchestrator orchestrator, TaskMetricsService metricsService) {
        this.orchestrator = orchestrator;
        this.metricsService = metricsService;
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        return ResponseEntity.ok(Map.of("success", true, "agents", orchestrator.getAgentStatus()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<?> metrics(@RequestHeader(TaskController.USER_HEADER) String userId) {
        return ResponseEntity.ok(Map.of("success", true, "metrics", metricsService.metricsFor(userId)));
    }
}
