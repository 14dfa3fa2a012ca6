package com.autonomous.gateway.controller;

import com.autonomous.gateway.scheduler.ChatTaskScheduler;
import com.autonomous.gateway.scheduler.ScheduledChatTask;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScheduledTaskInfo {
    String id;
    String title;
    String taskRequest;
    long intervalSeconds;
    boolean executeImmediately;
    String sessionId;
    long createdAt;
    boolean running;
    long secondsUntilNext;
    String providerId;
    String model;

    public static ScheduledTaskInfo from(ChatTaskScheduler scheduler) {
        ScheduledChatTask task = scheduler.getTask();
        return ScheduledTaskInfo.builder()
            .id(task.getId())
            .title(task.getTitle())
            .taskRequest(task.getTaskRequest())
            .intervalSeconds(task.getIntervalSeconds())
            .executeImmediately(task.isExecuteImmediately())
            .sessionId(scheduler.getBinding().getSessionId())
            .createdAt(task.getCreatedAt())
            .running(scheduler.isRunning())
            .secondsUntilNext(scheduler.getSecondsUntilNextExecution())
            .providerId(task.getProviderId() != null ? task.getProviderId().getId() : null)
            .model(task.getModel())
            .build();
    }
}
