package com.autonomous.gateway.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private CountingScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private static ScheduledTask task(long intervalSeconds, boolean executeImmediately) {
        return new ScheduledTask() {
            @Override
            public String getId() {
                return "test-task";
            }

            @Override
            public long getIntervalSeconds() {
                return intervalSeconds;
            }

            @Override
            public boolean isExecuteImmediately() {
                return executeImmediately;
            }

            @Override
            public long getCreatedAt() {
                return 0;
            }
        };
    }

    static class CountingScheduler extends TaskScheduler<ScheduledTask> {
        final AtomicInteger executions = new AtomicInteger();
        final List<Exception> errors = new CopyOnWriteArrayList<>();
        volatile boolean failing;
        volatile int failOnExecution;

        CountingScheduler(ScheduledTask task) {
            super(task);
        }

        @Override
        protected void onTaskExecution() {
            int execution = executions.incrementAndGet();
            if (failing || execution == failOnExecution) {
                throw new IllegalStateException("tick failed");
            }
        }

        @Override
        protected void onTaskError(Exception error) {
            errors.add(error);
        }
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new CountingScheduler(task(0, false)));
        assertThrows(IllegalArgumentException.class, () -> new CountingScheduler(task(-5, false)));
    }

    @Test
    void shouldExecuteImmediatelyWhenRequested() {
        scheduler = new CountingScheduler(task(60, true));

        scheduler.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.executions.get() == 1);
        assertTrue(scheduler.isRunning());
    }

    @Test
    void shouldWaitOneIntervalBeforeFirstTick() throws InterruptedException {
        scheduler = new CountingScheduler(task(60, false));

        scheduler.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.getNextExecutionTime() > 0);
        Thread.sleep(200);

        assertEquals(0, scheduler.executions.get());
        assertTrue(scheduler.getSecondsUntilNextExecution() > 50);
    }

    @Test
    void shouldTickOnInterval() {
        scheduler = new CountingScheduler(task(1, false));

        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.executions.get() >= 2);
    }

    @Test
    void shouldRunSingleLoopWhenStartedTwice() throws InterruptedException {
        scheduler = new CountingScheduler(task(60, true));

        scheduler.start();
        scheduler.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.executions.get() >= 1);
        Thread.sleep(300);

        assertEquals(1, scheduler.executions.get());
    }

    @Test
    void shouldReportNextExecutionTime() {
        scheduler = new CountingScheduler(task(30, false));
        long before = System.currentTimeMillis();

        scheduler.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.getNextExecutionTime() > 0);
        long next = scheduler.getNextExecutionTime();
        assertTrue(next >= before + 30_000);
        assertTrue(next <= System.currentTimeMillis() + 30_000);
    }

    @Test
    void shouldClearScheduleOnStop() {
        scheduler = new CountingScheduler(task(30, false));
        scheduler.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.getNextExecutionTime() > 0);

        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertEquals(0, scheduler.getSecondsUntilNextExecution());
        assertEquals(0, scheduler.getNextExecutionTime());
        assertEquals(0, scheduler.executions.get());
    }

    @Test
    void shouldRestartAfterStop() {
        scheduler = new CountingScheduler(task(60, true));
        scheduler.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.executions.get() == 1);
        scheduler.stop();

        scheduler.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.executions.get() == 2);
        assertTrue(scheduler.isRunning());
    }

    @Test
    void shouldKeepTickingAfterFailure() {
        scheduler = new CountingScheduler(task(1, true));
        scheduler.failing = true;

        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.executions.get() >= 2);
        assertTrue(scheduler.isRunning());
        assertTrue(scheduler.errors.size() >= 1);
        assertEquals("tick failed", scheduler.errors.get(0).getMessage());
    }

    @Test
    void shouldContinueCountingAfterSingleFailedTick() {
        scheduler = new CountingScheduler(task(1, true));
        scheduler.failOnExecution = 2;

        scheduler.start();

        await().atMost(Duration.ofSeconds(8)).until(() -> scheduler.executions.get() >= 4);
        assertTrue(scheduler.isRunning());
        assertEquals(1, scheduler.errors.size());
        assertEquals("tick failed", scheduler.errors.get(0).getMessage());
    }

    @Test
    void shouldIgnoreStopWhenNotRunning() {
        scheduler = new CountingScheduler(task(10, false));

        assertDoesNotThrow(() -> scheduler.stop());
        assertFalse(scheduler.isRunning());
    }

    @Test
    void shouldRefuseStartAfterShutdown() {
        scheduler = new CountingScheduler(task(10, false));
        scheduler.start();

        scheduler.shutdown();

        assertFalse(scheduler.isRunning());
        assertThrows(IllegalStateException.class, () -> scheduler.start());
    }
}
