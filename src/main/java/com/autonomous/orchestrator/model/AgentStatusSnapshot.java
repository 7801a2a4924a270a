package com.autonomous.orchestrator.model;

import lombok.Value;

import java.util.List;

@Value
public class AgentStatusSnapshot {
    String id;
    String name;
    AgentStatus status;
    List<String> specialization;
    int knowledgeBaseSize;
    double curiosityLevel;
}
