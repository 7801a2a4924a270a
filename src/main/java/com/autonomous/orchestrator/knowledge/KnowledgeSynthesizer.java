package com.autonomous.orchestrator.knowledge;

import com.autonomous.orchestrator.model.KnowledgeItem;
import com.autonomous.orchestrator.model.SourceRecord;
import com.autonomous.orchestrator.service.AiInsightService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Merges the records retrieved for one query into a single scored {@link KnowledgeItem}.
 */
@Component
public class KnowledgeSynthesizer {

    static final String SOURCE_LABEL = "Multi-source synthesis";

    private final AiInsightService aiInsightService;
    private final Clock clock;

    public KnowledgeSynthesizer(AiInsightService aiInsightService, Clock clock) {
        this.aiInsightService = aiInsightService;
        this.clock = clock;
    }

    public KnowledgeItem synthesize(String query, List<SourceRecord> records) {
        List<SourceRecord> valid = records.stream()
            .filter(Objects::nonNull)
            .filter(SourceRecord::hasContent)
            .toList();

        String content = aiInsightService.synthesizeInformation(query, valid);
        List<String> relatedTopics = aiInsightService.extractRelatedTopics(content);
        String topic = aiInsightService.extractMainTopic(query);

        return KnowledgeItem.builder()
            .query(query)
            .topic(topic)
            .content(content)
            .source(SOURCE_LABEL)
            .confidence(confidenceFor(valid.size()))
            .timestamp(clock.instant())
            .relatedTopics(relatedTopics)
            .build();
    }

    /**
     * Coarse step function of the number of usable sources.
     */
    public static double confidenceFor(int sourceCount) {
        if (sourceCount <= 0) return 0.1;
        if (sourceCount == 1) return 0.6;
        if (sourceCount == 2) return 0.8;
        return 0.95;
    }
}
