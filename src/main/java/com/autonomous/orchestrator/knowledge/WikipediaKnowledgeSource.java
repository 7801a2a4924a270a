package com.autonomous.orchestrator.knowledge;

import com.autonomous.orchestrator.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Encyclopedic lookup against the Wikipedia REST summary endpoint, by page title.
 */
@Slf4j
@Component
@Order(2)
public class WikipediaKnowledgeSource implements KnowledgeSource {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public WikipediaKnowledgeSource(RestTemplate restTemplate,
                                    @Value("${orchestrator.knowledge.wikipedia-url:https://en.wikipedia.org/api/rest_v1}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public String name() {
        return "Wikipedia";
    }

    @Override
    public List<SourceRecord> retrieve(String query) {
        JsonNode summary;
        try {
            summary = restTemplate.getForObject(baseUrl + "/page/summary/{title}", JsonNode.class, query);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No Wikipedia page for \"{}\"", query);
            return List.of();
        }
        if (summary == null || !summary.hasNonNull("extract") || summary.get("extract").asText().isBlank()) {
            return List.of();
        }
        return List.of(SourceRecord.builder()
            .title(summary.path("title").asText(query))
            .content(summary.get("extract").asText())
            .source(name())
            .url(summary.path("content_urls").path("desktop").path("page").asText(null))
            .build());
    }
}
