package com.autonomous.orchestrator.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class SubmitTaskRequest {
    @NotBlank
    @Size(max = 5000)
    private String prompt;
    private Map<String, Object> context = new HashMap<>();
}
