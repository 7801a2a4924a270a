package com.autonomous.orchestrator.notification;

/**
 * Per-user push channel. Events are only ever delivered to the user they are addressed to.
 */
public interface NotificationChannel {

    void publish(String userId, String eventName, Object payload);
}
