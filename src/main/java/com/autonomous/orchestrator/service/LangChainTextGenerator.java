package com.autonomous.orchestrator.service;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link TextGenerator} backed by langchain4j chat models, one model instance per model name.
 */
@Slf4j
public class LangChainTextGenerator implements TextGenerator {

    private final Function<String, ChatModel> modelFactory;
    private final String defaultModel;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public LangChainTextGenerator(Function<String, ChatModel> modelFactory, String defaultModel) {
        this.modelFactory = modelFactory;
        this.defaultModel = defaultModel;
    }

    @Override
    public String generate(String prompt, String systemInstructions, String modelHint) {
        String modelName = modelHint == null || modelHint.isBlank() ? defaultModel : modelHint;

        List<ChatMessage> messages = new ArrayList<>();
        if (systemInstructions != null && !systemInstructions.isBlank()) {
            messages.add(SystemMessage.from(systemInstructions));
        }
        messages.add(UserMessage.from(prompt));

        long start = System.currentTimeMillis();
        try {
            ChatModel model = models.computeIfAbsent(modelName, modelFactory);
            String text = model.chat(messages).aiMessage().text();
            log.debug("Generated {} chars with {} in {} ms",
                text == null ? 0 : text.length(), modelName, System.currentTimeMillis() - start);
            return text == null ? "" : text;
        } catch (RuntimeException e) {
            throw new TextGenerationException("Text generation failed (model=" + modelName + "): " + e.getMessage(), e);
        }
    }
}
