package com.autonomous.orchestrator.knowledge;

import com.autonomous.orchestrator.model.SourceRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Generic web lookup. No search provider is wired in yet, so this yields a single placeholder
 * hit per query; results are capped at the configured maximum.
 */
@Component
@Order(1)
public class WebSearchKnowledgeSource implements KnowledgeSource {

    private final int maxResults;

    public WebSearchKnowledgeSource(@Value("${orchestrator.knowledge.web-max-results:3}") int maxResults) {
        this.maxResults = maxResults;
    }

    @Override
    public String name() {
        return "Web Search";
    }

    @Override
    public List<SourceRecord> retrieve(String query) {
        return search(query).stream().limit(maxResults).toList();
    }

    // TODO: call a real search API (Custom Search / Bing) once credentials are provisioned
    protected List<SourceRecord> search(String query) {
        return List.of(SourceRecord.builder()
            .title("Search result for: " + query)
            .content("Relevant information about " + query + " from web sources.")
            .source(name())
            .url("https://example.com")
            .build());
    }
}
