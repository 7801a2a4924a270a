package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TaskMetrics {
    long totalTasks;
    long completedTasks;
    long failedTasks;
    String successRate;
    String avgProcessingTime;
}
