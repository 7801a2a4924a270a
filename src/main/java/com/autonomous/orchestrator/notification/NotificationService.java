package com.autonomous.orchestrator.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fans task events out to every configured {@link NotificationChannel}. A failing channel is
 * logged and skipped.
 */
@Slf4j
@Service
public class NotificationService {

    public static final String TASK_PROGRESS = "task-progress";
    public static final String TASK_ERROR = "task-error";

    private final List<NotificationChannel> channels;

    public NotificationService(List<NotificationChannel> channels) {
        this.channels = List.copyOf(channels);
    }

    public void publish(String userId, String eventName, Object payload) {
        for (NotificationChannel channel : channels) {
            try {
                channel.publish(userId, eventName, payload);
            } catch (RuntimeException e) {
                log.warn("Failed to publish {} to user {} via {}: {}",
                    eventName, userId, channel.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
