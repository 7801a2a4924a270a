package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.notification.SseNotificationChannel;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/events")
public class EventStreamController {

    private final SseNotificationChannel sseChannel;

    public EventStreamController(SseNotificationChannel sseChannel) {
        this.sseChannel = sseChannel;
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestHeader(TaskController.USER_HEADER) String userId) {
        return sseChannel.register(userId);
    }
}
