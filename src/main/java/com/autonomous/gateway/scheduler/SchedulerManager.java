package com.autonomous.gateway.scheduler;

import com.autonomous.gateway.error.NotFoundException;
import com.autonomous.gateway.error.ValidationException;
import com.autonomous.gateway.service.SendMessageService;
import com.autonomous.gateway.service.SessionRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Owns every {@link ChatTaskScheduler}: creates, starts, stops and deletes them, and
 * keeps the task store in sync. Stored tasks are restored and started on startup.
 */
@Slf4j
@Service
public class SchedulerManager {

    @Value("${scheduler.min-interval-seconds:10}")
    private long minIntervalSeconds;

    private final SessionRepository sessionRepository;
    private final SendMessageService sendMessageService;
    private final ScheduledTaskStorage storage;

    private final Map<String, ChatTaskScheduler> schedulers = new ConcurrentHashMap<>();

    public SchedulerManager(SessionRepository sessionRepository, SendMessageService sendMessageService,
                            ScheduledTaskStorage storage) {
        this.sessionRepository = sessionRepository;
        this.sendMessageService = sendMessageService;
        this.storage = storage;
    }

    public void setMinIntervalSeconds(long minIntervalSeconds) {
        this.minIntervalSeconds = minIntervalSeconds;
    }

    @PostConstruct
    public void loadTasks() {
        log.info("Loading scheduled tasks...");
        for (ScheduledTaskRecord record : storage.loadAll()) {
            try {
                restore(record);
            } catch (Exception e) {
                log.error("Failed to restore task {}: {}", record.getId(), e.getMessage(), e);
            }
        }
        log.info("Restored {} scheduled tasks", schedulers.size());
    }

    /**
     * Validates, initializes and persists a new task, then starts it. Nothing is
     * left registered when the task cannot be persisted.
     *
     * @throws ValidationException when the request is blank or the interval is too short
     */
    public ChatTaskScheduler createTask(ScheduledChatTask task) {
        validate(task);
        log.info("Creating scheduled task {}", task.getId());

        ChatTaskScheduler scheduler = newScheduler(task, new TaskBinding());
        scheduler.initialize();
        try {
            storage.save(ScheduledTaskRecord.of(task, scheduler.getBinding()));
        } catch (RuntimeException e) {
            log.error("Failed to persist task {}, discarding it: {}", task.getId(), e.getMessage());
            sessionRepository.deleteSession(scheduler.getBinding().getSessionId());
            throw e;
        }
        schedulers.put(task.getId(), scheduler);
        scheduler.start();

        log.info("Scheduled task created and started: {}, sessionId={}",
            task.getId(), scheduler.getBinding().getSessionId());
        return scheduler;
    }

    public void startTask(String taskId) {
        log.info("Starting task {}", taskId);
        getScheduler(taskId).start();
    }

    public void stopTask(String taskId) {
        log.info("Stopping task {}", taskId);
        getScheduler(taskId).stop();
    }

    /**
     * Stops the scheduler and removes the task, its stored file and its session.
     */
    public void deleteTask(String taskId) {
        ChatTaskScheduler scheduler = schedulers.remove(taskId);
        if (scheduler == null) {
            throw new NotFoundException("Scheduled task not found: " + taskId);
        }
        log.info("Deleting task {}", taskId);
        scheduler.shutdown();
        storage.delete(taskId);

        String sessionId = scheduler.getBinding().getSessionId();
        if (sessionId != null) {
            sessionRepository.deleteSession(sessionId);
        }
        log.info("Task deleted: {}", taskId);
    }

    public ScheduledChatTask getTask(String taskId) {
        return getScheduler(taskId).getTask();
    }

    public ChatTaskScheduler getScheduler(String taskId) {
        ChatTaskScheduler scheduler = taskId == null ? null : schedulers.get(taskId);
        if (scheduler == null) {
            throw new NotFoundException("Scheduled task not found: " + taskId);
        }
        return scheduler;
    }

    public List<ChatTaskScheduler> getAllSchedulers() {
        return schedulers.values().stream()
            .sorted(Comparator.comparingLong(scheduler -> scheduler.getTask().getCreatedAt()))
            .collect(Collectors.toList());
    }

    public List<ScheduledChatTask> getAllTasks() {
        return getAllSchedulers().stream()
            .map(ChatTaskScheduler::getTask)
            .collect(Collectors.toList());
    }

    public Optional<ScheduledChatTask> getTaskBySessionId(String sessionId) {
        return schedulers.values().stream()
            .filter(scheduler -> sessionId != null && sessionId.equals(scheduler.getBinding().getSessionId()))
            .map(ChatTaskScheduler::getTask)
            .findFirst();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down scheduler manager...");
        for (ChatTaskScheduler scheduler : new ArrayList<>(schedulers.values())) {
            try {
                scheduler.shutdown();
                storage.save(ScheduledTaskRecord.of(scheduler.getTask(), scheduler.getBinding()));
            } catch (Exception e) {
                log.error("Failed to shut down scheduler {}: {}", scheduler.getTask().getId(), e.getMessage(), e);
            }
        }
        schedulers.clear();
        log.info("Scheduler manager shutdown complete");
    }

    // Sessions live in memory, so a restored task may point at a session that is gone.
    private void restore(ScheduledTaskRecord record) {
        ChatTaskScheduler scheduler = newScheduler(record.toTask(), record.toBinding());
        TaskBinding binding = scheduler.getBinding();
        if (!binding.isBound() || sessionRepository.findSession(binding.getSessionId()).isEmpty()) {
            log.info("Session of task {} is gone, starting a new one", record.getId());
            scheduler.initialize();
            storage.save(ScheduledTaskRecord.of(scheduler.getTask(), binding));
        }
        schedulers.put(record.getId(), scheduler);
        scheduler.start();
        log.debug("Restored task {}", record.getId());
    }

    private ChatTaskScheduler newScheduler(ScheduledChatTask task, TaskBinding binding) {
        return new ChatTaskScheduler(task, binding, sessionRepository, sendMessageService);
    }

    private void validate(ScheduledChatTask task) {
        List<String> errors = new ArrayList<>();
        if (task.getTaskRequest() == null || task.getTaskRequest().isBlank()) {
            errors.add("Task request must not be blank");
        }
        if (task.getIntervalSeconds() < minIntervalSeconds) {
            errors.add("Interval must be at least " + minIntervalSeconds + " seconds");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid scheduled task", errors);
        }
    }
}
