package com.autonomous.gateway.service;

import com.autonomous.gateway.compression.CompressionResult;
import com.autonomous.gateway.error.NotFoundException;
import com.autonomous.gateway.model.ChatSession;
import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Slf4j
@Repository
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    @Override
    public ChatSession createSession(String scheduledTaskId) {
        ChatSession session = new ChatSession(UUID.randomUUID().toString());
        session.setScheduledTaskId(scheduledTaskId);
        sessions.put(session.getId(), session);
        log.debug("Created session {} (task: {})", session.getId(), scheduledTaskId);
        return session.copy();
    }

    @Override
    public ChatSession getSession(String sessionId) {
        return findSession(sessionId)
            .orElseThrow(() -> new NotFoundException("Session not found: " + sessionId));
    }

    @Override
    public Optional<ChatSession> findSession(String sessionId) {
        ChatSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.of(session.copy());
        }
    }

    @Override
    public List<ChatSession> getAllSessions() {
        return sessions.values().stream()
            .map(session -> {
                synchronized (session) {
                    return session.copy();
                }
            })
            .sorted(Comparator.comparingLong(ChatSession::getCreatedAt))
            .collect(Collectors.toList());
    }

    @Override
    public Message appendMessage(String sessionId, MessageRole role, String content) {
        Message message = Message.of(role, content);
        appendMessage(sessionId, message);
        return message;
    }

    @Override
    public void appendMessage(String sessionId, Message message) {
        mutate(sessionId, session -> session.addMessage(message));
    }

    @Override
    public List<Message> getMessages(String sessionId) {
        return getSession(sessionId).getMessages();
    }

    @Override
    public void updateTitle(String sessionId, String title) {
        mutate(sessionId, session -> session.setTitle(title));
    }

    @Override
    public void updateCompressionConfig(String sessionId, CompressionConfig config) {
        mutate(sessionId, session -> session.setCompressionConfig(config.copy()));
    }

    @Override
    public void applyCompression(String sessionId, CompressionResult result) {
        mutate(sessionId, session -> {
            List<Message> current = session.getMessages();
            List<Message> messages = new ArrayList<>(result.getNewMessages());
            // turns appended while the summary was being generated
            if (current.size() > result.getOriginalMessageCount()) {
                messages.addAll(current.subList(result.getOriginalMessageCount(), current.size()));
            }
            session.getArchivedMessages().addAll(result.getArchivedMessages());
            session.setMessages(messages);
            session.setCompressionCount(session.getCompressionCount() + 1);
        });
    }

    @Override
    public boolean deleteSession(String sessionId) {
        boolean removed = sessionId != null && sessions.remove(sessionId) != null;
        if (removed) {
            log.debug("Deleted session {}", sessionId);
        }
        return removed;
    }

    private void mutate(String sessionId, Consumer<ChatSession> change) {
        ChatSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new NotFoundException("Session not found: " + sessionId);
        }
        synchronized (session) {
            change.accept(session);
            session.setLastAccessedAt(System.currentTimeMillis());
        }
    }
}
