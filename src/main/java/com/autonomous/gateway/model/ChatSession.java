package com.autonomous.gateway.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class ChatSession {
    private String id;
    private String title;
    private String scheduledTaskId;
    private List<Message> messages = new ArrayList<>();
    private List<Message> archivedMessages = new ArrayList<>();
    private CompressionConfig compressionConfig = new CompressionConfig();
    private int compressionCount;
    private long createdAt = System.currentTimeMillis();
    private long lastAccessedAt = System.currentTimeMillis();

    public ChatSession(String id) {
        this.id = id;
    }

    public void addMessage(Message message) {
        messages.add(message);
        lastAccessedAt = System.currentTimeMillis();
    }

    /** Snapshot safe to hand out while the store keeps mutating the original. */
    public ChatSession copy() {
        ChatSession copy = new ChatSession(id);
        copy.setTitle(title);
        copy.setScheduledTaskId(scheduledTaskId);
        copy.setMessages(new ArrayList<>(messages));
        copy.setArchivedMessages(new ArrayList<>(archivedMessages));
        copy.setCompressionConfig(compressionConfig.copy());
        copy.setCompressionCount(compressionCount);
        copy.setCreatedAt(createdAt);
        copy.setLastAccessedAt(lastAccessedAt);
        return copy;
    }
}
