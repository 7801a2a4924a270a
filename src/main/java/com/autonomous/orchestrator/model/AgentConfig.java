package com.autonomous.orchestrator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the agent roster file.
 */
@Data
public class AgentConfig {
    private String name;
    private List<String> personality = new ArrayList<>();
    private List<String> specialization = new ArrayList<>();
    private double curiosityLevel;
    private double learningRate;
}
