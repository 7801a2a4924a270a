package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.knowledge.KnowledgeSeeker;
import com.autonomous.orchestrator.model.KnowledgeItem;
import com.autonomous.orchestrator.model.SeekKnowledgeRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/knowledge")
public class KnowledgeController {

    private final KnowledgeSeeker knowledgeSeeker;

    public KnowledgeController(KnowledgeSeeker knowledgeSeeker) {
        this.knowledgeSeeker = knowledgeSeeker;
    }

    @PostMapping("/seek")
    public ResponseEntity<?> seek(@Valid @RequestBody SeekKnowledgeRequest request) {
        List<KnowledgeItem> items = new ArrayList<>(knowledgeSeeker.seekKnowledge(request.getQueries()));
        if (request.isExpand()) {
            items.addAll(knowledgeSeeker.expandKnowledge(List.copyOf(items)));
        }
        return ResponseEntity.ok(Map.of("success", true, "knowledge", items));
    }
}
