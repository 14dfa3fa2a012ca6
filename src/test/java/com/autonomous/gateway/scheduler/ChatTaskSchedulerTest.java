package com.autonomous.gateway.scheduler;

import com.autonomous.gateway.error.NetworkException;
import com.autonomous.gateway.model.ChatSession;
import com.autonomous.gateway.model.Message;
import com.autonomous.gateway.model.MessageRole;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.Result;
import com.autonomous.gateway.service.InMemorySessionRepository;
import com.autonomous.gateway.service.MessageResult;
import com.autonomous.gateway.service.SendMessageService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ChatTaskSchedulerTest {

    private InMemorySessionRepository sessions;
    private SendMessageService sendMessageService;
    private ChatTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        sessions = new InMemorySessionRepository();
        sendMessageService = mock(SendMessageService.class);
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private ChatTaskScheduler scheduler(ScheduledChatTask task) {
        scheduler = new ChatTaskScheduler(task, new TaskBinding(), sessions, sendMessageService);
        return scheduler;
    }

    private static ScheduledChatTask.ScheduledChatTaskBuilder task() {
        return ScheduledChatTask.builder()
            .taskRequest("Summarize today's news")
            .intervalSeconds(3600);
    }

    @Test
    void shouldCreateSessionWithIntroduction() {
        ChatTaskScheduler chatScheduler = scheduler(task().title("News digest").build());

        chatScheduler.initialize();

        String sessionId = chatScheduler.getBinding().getSessionId();
        ChatSession session = sessions.getSession(sessionId);
        assertEquals("News digest", session.getTitle());
        assertEquals(chatScheduler.getTask().getId(), session.getScheduledTaskId());
        List<Message> messages = session.getMessages();
        assertEquals(1, messages.size());
        assertEquals(MessageRole.ASSISTANT, messages.get(0).getRole());
        assertEquals("I am the task scheduler.\nEvery 1 hour(s) I will run this task.\nMy task: Summarize today's news",
            messages.get(0).getText());
    }

    @Test
    void shouldDeriveTitleFromRequest() {
        String longRequest = "a".repeat(60);

        assertEquals("Task: " + "a".repeat(50) + "...",
            ChatTaskScheduler.title(task().taskRequest(longRequest).build()));
        assertEquals("Task: short...", ChatTaskScheduler.title(task().taskRequest("short").title(" ").build()));
    }

    @Test
    void shouldSendRequestIntoBoundSession() {
        when(sendMessageService.sendMessage(any(), any(), any(), any(), any()))
            .thenReturn(Result.success(MessageResult.builder().response("ok").build()));
        ChatTaskScheduler chatScheduler = scheduler(task().executeImmediately(true).model("gpt-5").build());
        chatScheduler.initialize();
        String sessionId = chatScheduler.getBinding().getSessionId();

        chatScheduler.start();

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(sendMessageService)
            .sendMessage(eq("Summarize today's news"), eq(sessionId), eq(ProviderType.CLAUDE), eq("gpt-5"), any()));
    }

    @Test
    void shouldPostFailureIntoSession() {
        when(sendMessageService.sendMessage(any(), any(), any(), isNull(), any()))
            .thenReturn(Result.failure(new NetworkException("Anthropic Claude API Error: overloaded")));
        ChatTaskScheduler chatScheduler = scheduler(task().executeImmediately(true)
            .providerId(ProviderType.OPENAI).build());
        chatScheduler.initialize();
        String sessionId = chatScheduler.getBinding().getSessionId();

        chatScheduler.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> sessions.getMessages(sessionId).size() == 2);
        assertEquals("Task execution failed:\nAnthropic Claude API Error: overloaded\n\nNext attempt in 1 hour(s)",
            sessions.getMessages(sessionId).get(1).getText());
        assertTrue(chatScheduler.isRunning());
        verify(sendMessageService).sendMessage(any(), eq(sessionId), eq(ProviderType.OPENAI), isNull(), any());
    }

    @Test
    void shouldSkipTickWithoutSession() {
        ChatTaskScheduler chatScheduler = scheduler(task().executeImmediately(true).build());

        assertDoesNotThrow(chatScheduler::onTaskExecution);
        verifyNoInteractions(sendMessageService);
    }

    @Test
    void shouldFormatIntervals() {
        assertEquals("45 second(s)", ChatTaskScheduler.formatInterval(45));
        assertEquals("5 minute(s)", ChatTaskScheduler.formatInterval(300));
        assertEquals("2 hour(s)", ChatTaskScheduler.formatInterval(7200));
        assertEquals("3 day(s)", ChatTaskScheduler.formatInterval(259_200));
    }

    @Test
    void shouldUseUnknownErrorWhenMessageIsMissing() {
        ChatTaskScheduler chatScheduler = scheduler(task().intervalSeconds(30).build());

        assertTrue(chatScheduler.errorMessage(new RuntimeException()).startsWith("Task execution failed:\nUnknown error"));
    }
}
