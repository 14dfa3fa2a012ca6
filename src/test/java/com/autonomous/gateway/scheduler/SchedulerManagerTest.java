package com.autonomous.gateway.scheduler;

import com.autonomous.gateway.error.DatabaseException;
import com.autonomous.gateway.error.NotFoundException;
import com.autonomous.gateway.error.ValidationException;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.service.InMemorySessionRepository;
import com.autonomous.gateway.service.SendMessageService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SchedulerManagerTest {

    @TempDir
    Path tempDir;

    private InMemorySessionRepository sessions;
    private ScheduledTaskStorage storage;
    private SchedulerManager manager;

    @BeforeEach
    void setUp() {
        sessions = new InMemorySessionRepository();
        storage = new ScheduledTaskStorage();
        storage.setStoragePath(tempDir.toString());
        manager = newManager();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private SchedulerManager newManager() {
        SchedulerManager schedulerManager = new SchedulerManager(sessions, mock(SendMessageService.class), storage);
        schedulerManager.setMinIntervalSeconds(10);
        return schedulerManager;
    }

    private static ScheduledChatTask task(String request, long intervalSeconds) {
        return ScheduledChatTask.builder()
            .taskRequest(request)
            .intervalSeconds(intervalSeconds)
            .providerId(ProviderType.CLAUDE)
            .build();
    }

    @Test
    void shouldCreateStartAndPersistTask() {
        ChatTaskScheduler scheduler = manager.createTask(task("Check the weather", 600));

        assertTrue(scheduler.isRunning());
        String sessionId = scheduler.getBinding().getSessionId();
        assertNotNull(sessionId);
        assertEquals(1, sessions.getMessages(sessionId).size());
        assertEquals(scheduler.getTask(), manager.getTask(scheduler.getTask().getId()));
        assertEquals(scheduler.getTask(), manager.getTaskBySessionId(sessionId).orElseThrow());

        List<ScheduledTaskRecord> stored = storage.loadAll();
        assertEquals(1, stored.size());
        assertEquals(sessionId, stored.get(0).getSessionId());
    }

    @Test
    void shouldDiscardTaskWhenItCannotBePersisted() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        storage.setStoragePath(blocker.resolve("tasks").toString());

        assertThrows(DatabaseException.class, () -> manager.createTask(task("Check the weather", 600)));

        assertTrue(manager.getAllTasks().isEmpty());
        assertTrue(sessions.getAllSessions().isEmpty());
    }

    @Test
    void shouldRejectInvalidTask() {
        ValidationException error = assertThrows(ValidationException.class, () -> manager.createTask(task(" ", 5)));

        assertEquals(List.of("Task request must not be blank", "Interval must be at least 10 seconds"),
            error.getErrors());
        assertTrue(manager.getAllTasks().isEmpty());
        assertTrue(sessions.getAllSessions().isEmpty());
    }

    @Test
    void shouldStopAndStartTask() {
        String id = manager.createTask(task("Ping", 600)).getTask().getId();

        manager.stopTask(id);
        assertFalse(manager.getScheduler(id).isRunning());

        manager.startTask(id);
        assertTrue(manager.getScheduler(id).isRunning());
    }

    @Test
    void shouldDeleteTaskWithItsSessionAndFile() {
        ChatTaskScheduler scheduler = manager.createTask(task("Ping", 600));
        String id = scheduler.getTask().getId();
        String sessionId = scheduler.getBinding().getSessionId();

        manager.deleteTask(id);

        assertFalse(scheduler.isRunning());
        assertTrue(sessions.findSession(sessionId).isEmpty());
        assertTrue(storage.loadAll().isEmpty());
        assertThrows(NotFoundException.class, () -> manager.getTask(id));
        assertThrows(NotFoundException.class, () -> manager.deleteTask(id));
    }

    @Test
    void shouldListTasksInCreationOrder() {
        ScheduledChatTask first = task("first", 600).toBuilder().createdAt(1000).build();
        ScheduledChatTask second = task("second", 600).toBuilder().createdAt(2000).build();
        manager.createTask(second);
        manager.createTask(first);

        List<ScheduledChatTask> tasks = manager.getAllTasks();

        assertEquals(List.of(first, second), tasks);
    }

    @Test
    void shouldRestoreTasksWithLiveSession() {
        ChatTaskScheduler original = manager.createTask(task("Ping", 600));
        String sessionId = original.getBinding().getSessionId();
        manager.shutdown();

        SchedulerManager restarted = newManager();
        restarted.loadTasks();
        try {
            ChatTaskScheduler restored = restarted.getScheduler(original.getTask().getId());
            assertTrue(restored.isRunning());
            assertEquals(sessionId, restored.getBinding().getSessionId());
            assertEquals(1, sessions.getMessages(sessionId).size());
        } finally {
            restarted.shutdown();
        }
    }

    @Test
    void shouldStartFreshSessionWhenStoredOneIsGone() {
        ChatTaskScheduler original = manager.createTask(task("Ping", 600));
        String oldSessionId = original.getBinding().getSessionId();
        manager.shutdown();
        sessions.deleteSession(oldSessionId);

        SchedulerManager restarted = newManager();
        restarted.loadTasks();
        try {
            ChatTaskScheduler restored = restarted.getScheduler(original.getTask().getId());
            String newSessionId = restored.getBinding().getSessionId();
            assertNotEquals(oldSessionId, newSessionId);
            assertTrue(sessions.findSession(newSessionId).isPresent());
            assertEquals(newSessionId, storage.loadAll().get(0).getSessionId());
        } finally {
            restarted.shutdown();
        }
    }
}
