package com.autonomous.orchestrator.model;

import lombok.Value;

import java.time.Instant;

@Value
public class KnowledgeEntry {
    public static final double DEFAULT_CONFIDENCE = 0.8;

    KnowledgeItem item;
    Instant ingestedAt;
    double confidence;

    public static KnowledgeEntry ingest(KnowledgeItem item, Instant now) {
        double confidence = item.getConfidence() != null ? item.getConfidence() : DEFAULT_CONFIDENCE;
        return new KnowledgeEntry(item, now, confidence);
    }
}
