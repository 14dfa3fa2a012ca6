package com.autonomous.gateway.scheduler;

import com.autonomous.gateway.model.MessageRole;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.RequestParameters;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.service.MessageResult;
import com.autonomous.gateway.service.SendMessageService;
import com.autonomous.gateway.service.SessionRepository;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends the task's request into its bound chat session on every tick. Failures are
 * posted into the same session so the conversation shows them.
 */
@Slf4j
public class ChatTaskScheduler extends TaskScheduler<ScheduledChatTask> {

    static final ProviderType DEFAULT_PROVIDER = ProviderType.CLAUDE;
    private static final int TITLE_PREVIEW_LENGTH = 50;

    private final TaskBinding binding;
    private final SessionRepository sessionRepository;
    private final SendMessageService sendMessageService;

    public ChatTaskScheduler(ScheduledChatTask task, TaskBinding binding, SessionRepository sessionRepository,
                             SendMessageService sendMessageService) {
        super(task);
        this.binding = binding;
        this.sessionRepository = sessionRepository;
        this.sendMessageService = sendMessageService;
    }

    /**
     * Creates the task's session, posts the introduction and sets the session title.
     * Only for new tasks; restored tasks keep their existing session.
     */
    public void initialize() {
        log.info("Initializing chat task scheduler for task {}", task.getId());

        String sessionId = sessionRepository.createSession(task.getId()).getId();
        binding.bind(sessionId);

        sessionRepository.appendMessage(sessionId, MessageRole.ASSISTANT, introduction());
        sessionRepository.updateTitle(sessionId, title(task));

        log.info("Chat task scheduler initialized: sessionId={}", sessionId);
    }

    public TaskBinding getBinding() {
        return binding;
    }

    @Override
    protected void onTaskExecution() {
        String sessionId = binding.getSessionId();
        if (sessionId == null) {
            log.error("Task {} has no session, skipping tick", task.getId());
            return;
        }

        log.debug("Executing chat task {}: sending message to session {}", task.getId(), sessionId);
        ProviderType provider = task.getProviderId() != null ? task.getProviderId() : DEFAULT_PROVIDER;

        Result<MessageResult> result = sendMessageService.sendMessage(
            task.getTaskRequest(), sessionId, provider, task.getModel(), RequestParameters.defaults());
        if (result.isFailure()) {
            throw result.getError();
        }
    }

    @Override
    protected void onTaskError(Exception error) {
        String sessionId = binding.getSessionId();
        if (sessionId == null) {
            return;
        }
        try {
            sessionRepository.appendMessage(sessionId, MessageRole.ASSISTANT, errorMessage(error));
        } catch (Exception e) {
            log.error("Failed to add error message to session {}: {}", sessionId, e.getMessage());
        }
    }

    static String title(ScheduledChatTask task) {
        if (task.getTitle() != null && !task.getTitle().isBlank()) {
            return task.getTitle();
        }
        String request = task.getTaskRequest();
        return "Task: " + (request.length() > TITLE_PREVIEW_LENGTH ? request.substring(0, TITLE_PREVIEW_LENGTH) : request)
            + "...";
    }

    String introduction() {
        return "I am the task scheduler.\n"
            + "Every " + formatInterval(task.getIntervalSeconds()) + " I will run this task.\n"
            + "My task: " + task.getTaskRequest();
    }

    String errorMessage(Exception error) {
        String reason = error.getMessage() != null ? error.getMessage() : "Unknown error";
        return "Task execution failed:\n"
            + reason + "\n\n"
            + "Next attempt in " + formatInterval(task.getIntervalSeconds());
    }

    static String formatInterval(long seconds) {
        if (seconds < 60) {
            return seconds + " second(s)";
        }
        if (seconds < 3600) {
            return seconds / 60 + " minute(s)";
        }
        if (seconds < 86400) {
            return seconds / 3600 + " hour(s)";
        }
        return seconds / 86400 + " day(s)";
    }
}
