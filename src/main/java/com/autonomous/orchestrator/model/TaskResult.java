package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TaskResult {
    String content;
    String agentId;
    String agentName;
    List<String> knowledgeTopics;
    double knowledgeConfidence;
    Instant generatedAt;
}
