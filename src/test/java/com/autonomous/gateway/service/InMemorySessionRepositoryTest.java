package com.autonomous.gateway.service;

import com.autonomous.gateway.compression.CompressionResult;
import com.autonomous.gateway.error.NotFoundException;
import com.autonomous.gateway.model.ChatSession;
import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.CompressionStrategy;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionRepositoryTest {

    private final InMemorySessionRepository repository = new InMemorySessionRepository();

    @Test
    void shouldCreateAndFindSession() {
        ChatSession created = repository.createSession("task-1");

        ChatSession found = repository.getSession(created.getId());

        assertEquals("task-1", found.getScheduledTaskId());
        assertTrue(found.getMessages().isEmpty());
        assertEquals(1, repository.getAllSessions().size());
    }

    @Test
    void shouldAppendMessagesInOrder() {
        String id = repository.createSession(null).getId();

        repository.appendMessage(id, MessageRole.USER, "question");
        repository.appendMessage(id, MessageRole.ASSISTANT, "answer");

        List<Message> messages = repository.getMessages(id);
        assertEquals(2, messages.size());
        assertEquals(MessageRole.USER, messages.get(0).getRole());
        assertEquals("answer", messages.get(1).getText());
    }

    @Test
    void shouldHandOutSnapshots() {
        String id = repository.createSession(null).getId();
        ChatSession snapshot = repository.getSession(id);

        snapshot.getMessages().add(Message.of(MessageRole.USER, "local only"));
        snapshot.setTitle("changed");

        assertTrue(repository.getMessages(id).isEmpty());
        assertNull(repository.getSession(id).getTitle());
    }

    @Test
    void shouldNotShareCompressionConfigWithSnapshots() {
        String id = repository.createSession(null).getId();
        CompressionConfig config = new CompressionConfig();
        config.setEnabled(true);
        repository.updateCompressionConfig(id, config);

        config.setStrategy(CompressionStrategy.TOKEN_BASED);
        repository.getSession(id).getCompressionConfig().setEnabled(false);

        CompressionConfig stored = repository.getSession(id).getCompressionConfig();
        assertTrue(stored.isEnabled());
        assertEquals(CompressionStrategy.FULL_REPLACEMENT, stored.getStrategy());
    }

    @Test
    void shouldThrowForUnknownSession() {
        assertThrows(NotFoundException.class, () -> repository.getSession("missing"));
        assertThrows(NotFoundException.class, () -> repository.appendMessage("missing", MessageRole.USER, "x"));
        assertThrows(NotFoundException.class, () -> repository.updateTitle(null, "x"));
        assertTrue(repository.findSession(null).isEmpty());
    }

    @Test
    void shouldApplyCompressionAtomically() {
        String id = repository.createSession(null).getId();
        repository.appendMessage(id, MessageRole.USER, "one");
        repository.appendMessage(id, MessageRole.ASSISTANT, "two");
        List<Message> original = repository.getMessages(id);
        Message summary = Message.of(MessageRole.SYSTEM, "summary");

        repository.applyCompression(id, CompressionResult.compressed(original, List.of(summary), original));

        ChatSession session = repository.getSession(id);
        assertEquals(List.of(summary), session.getMessages());
        assertEquals(original, session.getArchivedMessages());
        assertEquals(1, session.getCompressionCount());
    }

    @Test
    void shouldKeepMessagesAppendedAfterCompressedSnapshot() {
        String id = repository.createSession(null).getId();
        repository.appendMessage(id, MessageRole.USER, "one");
        repository.appendMessage(id, MessageRole.ASSISTANT, "two");
        List<Message> original = repository.getMessages(id);
        repository.appendMessage(id, MessageRole.USER, "three");
        Message summary = Message.of(MessageRole.SYSTEM, "summary");

        repository.applyCompression(id, CompressionResult.compressed(original, List.of(summary), original));

        List<Message> messages = repository.getMessages(id);
        assertEquals(2, messages.size());
        assertEquals(summary, messages.get(0));
        assertEquals("three", messages.get(1).getText());
        assertEquals(original, repository.getSession(id).getArchivedMessages());
    }

    @Test
    void shouldDeleteSession() {
        String id = repository.createSession(null).getId();

        assertTrue(repository.deleteSession(id));
        assertFalse(repository.deleteSession(id));
        assertFalse(repository.deleteSession(null));
        assertTrue(repository.findSession(id).isEmpty());
    }
}
