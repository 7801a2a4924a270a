package com.autonomous.orchestrator.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class SeekKnowledgeRequest {
    @NotEmpty
    @Size(max = 20)
    private List<@NotBlank String> queries;
    private boolean expand;
}
