package com.autonomous.orchestrator.knowledge;

import com.autonomous.orchestrator.model.SourceRecord;
import com.autonomous.orchestrator.service.AiInsightService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(3)
public class GenerativeInsightSource implements KnowledgeSource {

    static final double BASELINE_CONFIDENCE = 0.8;

    private final AiInsightService aiInsightService;

    public GenerativeInsightSource(AiInsightService aiInsightService) {
        this.aiInsightService = aiInsightService;
    }

    @Override
    public String name() {
        return "AI Analysis";
    }

    @Override
    public List<SourceRecord> retrieve(String query) {
        String insights = aiInsightService.generateInsights(query);
        return List.of(SourceRecord.builder()
            .title("AI Insights: " + query)
            .content(insights)
            .source(name())
            .confidence(BASELINE_CONFIDENCE)
            .build());
    }
}
