package com.autonomous.gateway.service;

import com.autonomous.gateway.compression.CompressionResult;
import com.autonomous.gateway.model.ChatSession;
import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;

import java.util.List;
import java.util.Optional;

/**
 * Chat session store. Lookups by an unknown id throw
 * {@link com.autonomous.gateway.error.NotFoundException}; returned sessions are snapshots.
 */
public interface SessionRepository {

    ChatSession createSession(String scheduledTaskId);

    ChatSession getSession(String sessionId);

    Optional<ChatSession> findSession(String sessionId);

    List<ChatSession> getAllSessions();

    Message appendMessage(String sessionId, MessageRole role, String content);

    void appendMessage(String sessionId, Message message);

    List<Message> getMessages(String sessionId);

    void updateTitle(String sessionId, String title);

    void updateCompressionConfig(String sessionId, CompressionConfig config);

    /**
     * Archives the compressed messages, swaps in the new history and bumps the
     * compression count, as one step. Messages appended after the compressed
     * snapshot are kept after the new history.
     */
    void applyCompression(String sessionId, CompressionResult result);

    boolean deleteSession(String sessionId);
}
