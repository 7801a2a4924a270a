package com.autonomous.orchestrator.notification;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Slf4j
@Service
@ConditionalOnProperty(prefix = "notifications.slack", name = "enabled", havingValue = "true")
public class SlackService {

    private final Slack slack;
    private final String slackBotToken;

    @Autowired
    public SlackService(@Value("${slack.bot.token}") String slackBotToken) {
        this(Slack.getInstance(), slackBotToken);
    }

    SlackService(Slack slack, String slackBotToken) {
        this.slack = slack;
        this.slackBotToken = slackBotToken;
    }

    /**
     * Sends a direct message to a Slack member. Posting to a member id opens the DM with the bot.
     *
     * @return the message timestamp
     */
    public String postDirectMessage(String slackUserId, String message) {
        MethodsClient methods = slack.methods(slackBotToken);

        ChatPostMessageRequest request = ChatPostMessageRequest.builder()
            .channel(slackUserId)
            .text(message)
            .build();

        try {
            ChatPostMessageResponse response = methods.chatPostMessage(request);
            if (!response.isOk()) {
                throw new IllegalStateException("Slack rejected message: " + response.getError());
            }
            return response.getTs();
        } catch (IOException | SlackApiException e) {
            throw new IllegalStateException("Failed to post Slack message: " + e.getMessage(), e);
        }
    }
}
