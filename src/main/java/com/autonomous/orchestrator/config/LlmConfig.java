package com.autonomous.orchestrator.config;

import com.autonomous.orchestrator.service.LangChainTextGenerator;
import com.autonomous.orchestrator.service.TextGenerator;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {

    @Value("${llm.openai.api-key:}")
    private String apiKey;

    @Value("${llm.openai.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${llm.default-model:gpt-4o}")
    private String defaultModel;

    @Value("${llm.timeout-seconds:60}")
    private long timeoutSeconds;

    @Value("${llm.temperature:0.7}")
    private double temperature;

    @Value("${llm.max-tokens:2000}")
    private int maxTokens;

    @Bean
    public TextGenerator textGenerator() {
        return new LangChainTextGenerator(modelName -> OpenAiChatModel.builder()
            .baseUrl(baseUrl)
            .apiKey(apiKey)
            .modelName(modelName)
            .temperature(temperature)
            .maxTokens(maxTokens)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .build(), defaultModel);
    }
}
