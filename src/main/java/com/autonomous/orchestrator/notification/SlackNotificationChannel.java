package com.autonomous.orchestrator.notification;

import com.autonomous.orchestrator.model.TaskResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Mirrors task events into a Slack direct message. User ids are expected to be Slack member ids.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "notifications.slack", name = "enabled", havingValue = "true")
public class SlackNotificationChannel implements NotificationChannel {

    static final int SUMMARY_CHARS = 500;

    private final SlackService slackService;

    public SlackNotificationChannel(SlackService slackService) {
        this.slackService = slackService;
    }

    @Override
    public void publish(String userId, String eventName, Object payload) {
        String message = format(eventName, payload);
        if (message != null) {
            slackService.postDirectMessage(userId, message);
        }
    }

    String format(String eventName, Object payload) {
        if (!(payload instanceof Map<?, ?> event)) {
            return null;
        }
        if (NotificationService.TASK_PROGRESS.equals(eventName)) {
            StringBuilder message = new StringBuilder();
            message.append("*Task complete!*\n\n");
            message.append("*Task:* ").append(event.get("taskId")).append("\n");
            message.append("*Agent:* ").append(event.get("agent")).append("\n");
            if (event.get("result") instanceof TaskResult result) {
                String content = result.getContent();
                message.append("*Summary:* ")
                    .append(content.substring(0, Math.min(SUMMARY_CHARS, content.length())));
            }
            return message.toString();
        }
        if (NotificationService.TASK_ERROR.equals(eventName)) {
            return String.format("*Task failed*\n\n*Task:* %s\n*Error:* %s", event.get("taskId"), event.get("error"));
        }
        log.debug("No Slack format for event {}", eventName);
        return null;
    }
}
