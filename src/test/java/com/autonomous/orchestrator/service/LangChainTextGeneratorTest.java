package com.autonomous.orchestrator.service;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LangChainTextGeneratorTest {

    private final ChatModel model = mock(ChatModel.class);
    private final List<String> created = new ArrayList<>();

    private final LangChainTextGenerator generator = new LangChainTextGenerator(name -> {
        created.add(name);
        return model;
    }, "default-model");

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendSystemAndUserMessages() {
        when(model.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("answer")).build());

        assertEquals("answer", generator.generate("question", "be brief", "small-model"));

        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(model).chat(messages.capture());
        assertEquals(List.of(SystemMessage.from("be brief"), UserMessage.from("question")), messages.getValue());
        assertEquals(List.of("small-model"), created);
    }

    @Test
    void shouldUseDefaultModelAndCacheIt() {
        when(model.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("ok")).build());

        generator.generate("a", null, null);
        generator.generate("b", "", " ");

        assertEquals(List.of("default-model"), created);
    }

    @Test
    void shouldWrapModelFailures() {
        when(model.chat(anyList())).thenThrow(new RuntimeException("rate limited"));

        TextGenerationException error = assertThrows(TextGenerationException.class,
            () -> generator.generate("a", "s", "m"));
        assertTrue(error.getMessage().contains("rate limited"));
    }
}
