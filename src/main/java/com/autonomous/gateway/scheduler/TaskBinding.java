package com.autonomous.gateway.scheduler;

/**
 * Session a scheduled task posts into. Empty until the task is initialized or restored.
 */
public class TaskBinding {

    private volatile String sessionId;

    public TaskBinding() {
    }

    public TaskBinding(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void bind(String sessionId) {
        this.sessionId = sessionId;
    }

    public boolean isBound() {
        return sessionId != null;
    }
}
