package com.autonomous.gateway.scheduler;

import com.autonomous.gateway.model.ProviderType;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored form of a chat task together with its bound session.
 */
@Data
@NoArgsConstructor
public class ScheduledTaskRecord {
    private String id;
    private String title;
    private String taskRequest;
    private long intervalSeconds;
    private boolean executeImmediately;
    private ProviderType providerId;
    private String model;
    private long createdAt;
    private String sessionId;

    public static ScheduledTaskRecord of(ScheduledChatTask task, TaskBinding binding) {
        ScheduledTaskRecord record = new ScheduledTaskRecord();
        record.setId(task.getId());
        record.setTitle(task.getTitle());
        record.setTaskRequest(task.getTaskRequest());
        record.setIntervalSeconds(task.getIntervalSeconds());
        record.setExecuteImmediately(task.isExecuteImmediately());
        record.setProviderId(task.getProviderId());
        record.setModel(task.getModel());
        record.setCreatedAt(task.getCreatedAt());
        record.setSessionId(binding.getSessionId());
        return record;
    }

    public ScheduledChatTask toTask() {
        return ScheduledChatTask.builder()
            .id(id)
            .title(title)
            .taskRequest(taskRequest)
            .intervalSeconds(intervalSeconds)
            .executeImmediately(executeImmediately)
            .providerId(providerId)
            .model(model)
            .createdAt(createdAt)
            .build();
    }

    public TaskBinding toBinding() {
        return new TaskBinding(sessionId);
    }
}
