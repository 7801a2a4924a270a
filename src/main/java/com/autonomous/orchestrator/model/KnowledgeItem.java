package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class KnowledgeItem {
    String query;
    String topic;
    String content;
    String source;
    Double confidence;
    Instant timestamp;
    @Builder.Default
    List<String> relatedTopics = List.of();

    /** Topic when one was extracted, otherwise the originating query. */
    public String key() {
        return topic != null && !topic.isBlank() ? topic : query;
    }
}
