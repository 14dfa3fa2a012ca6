package com.autonomous.gateway.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one task on a fixed interval, on a thread of its own.
 * <p>
 * Ticks of one scheduler never overlap: the wait for the next tick starts only after
 * the previous execution (and its error handling) has returned. A failing tick is
 * logged, handed to {@link #onTaskError(Exception)}, and the loop keeps going.
 * {@link #stop()} cancels the pending wait; an execution already in progress runs to
 * completion.
 *
 * @param <T> the task type
 */
@Slf4j
public abstract class TaskScheduler<T extends ScheduledTask> {

    protected final T task;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService executor;

    private volatile CountDownLatch stopSignal;
    private volatile long nextExecutionTime;
    private volatile boolean terminated;

    protected TaskScheduler(T task) {
        if (task.getIntervalSeconds() <= 0) {
            throw new IllegalArgumentException("Interval must be positive, got " + task.getIntervalSeconds());
        }
        this.task = task;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "task-scheduler-" + task.getId());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Body of one tick.
     */
    protected abstract void onTaskExecution() throws Exception;

    /**
     * Called after a failed tick. The default only logs.
     */
    protected void onTaskError(Exception error) {
        log.error("Error in scheduled task {}: {}", task.getId(), error.getMessage());
    }

    /**
     * Starts the loop. A second call while running only logs a warning.
     *
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public void start() {
        if (terminated) {
            throw new IllegalStateException("Scheduler for task " + task.getId() + " has been shut down");
        }
        if (running.getAndSet(true)) {
            log.warn("Task {} is already running", task.getId());
            return;
        }

        CountDownLatch signal = new CountDownLatch(1);
        stopSignal = signal;
        log.info("Starting task {} with interval {}s (execute immediately: {})",
            task.getId(), task.getIntervalSeconds(), task.isExecuteImmediately());
        executor.execute(() -> runLoop(signal));
    }

    /**
     * Stops the loop without waiting for an in-progress execution. Calling it on a
     * stopped scheduler only logs a warning.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            log.warn("Task {} is not running", task.getId());
            return;
        }
        CountDownLatch signal = stopSignal;
        if (signal != null) {
            signal.countDown();
        }
        nextExecutionTime = 0;
        log.info("Stopped task {}", task.getId());
    }

    /**
     * Stops the loop and releases its thread. The scheduler cannot be restarted.
     */
    public void shutdown() {
        if (running.get()) {
            stop();
        }
        terminated = true;
        executor.shutdown();
    }

    public boolean isRunning() {
        return running.get();
    }

    public T getTask() {
        return task;
    }

    /** Epoch millis the pending wait ends at; 0 while stopped. */
    public long getNextExecutionTime() {
        return nextExecutionTime;
    }

    public long getSecondsUntilNextExecution() {
        long next = nextExecutionTime;
        if (!running.get() || next == 0) {
            return 0;
        }
        return Math.max(0, (next - System.currentTimeMillis()) / 1000);
    }

    private void runLoop(CountDownLatch signal) {
        long intervalMs = TimeUnit.SECONDS.toMillis(task.getIntervalSeconds());
        try {
            if (task.isExecuteImmediately() && isActive(signal)) {
                executeTask();
            }
            while (isActive(signal)) {
                nextExecutionTime = System.currentTimeMillis() + intervalMs;
                if (signal.await(intervalMs, TimeUnit.MILLISECONDS) || !isActive(signal)) {
                    break;
                }
                executeTask();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Scheduler thread for task {} interrupted", task.getId());
        } catch (RuntimeException e) {
            log.error("Scheduler loop for task {} failed: {}", task.getId(), e.getMessage(), e);
        }
        if (!running.get()) {
            nextExecutionTime = 0;
        }
        log.debug("Scheduler loop for task {} exited", task.getId());
    }

    private boolean isActive(CountDownLatch signal) {
        return running.get() && signal.getCount() > 0;
    }

    private void executeTask() {
        log.debug("Executing task {}", task.getId());
        try {
            onTaskExecution();
        } catch (Exception e) {
            log.error("Task {} execution failed: {}", task.getId(), e.getMessage(), e);
            try {
                onTaskError(e);
            } catch (Exception handlerError) {
                log.error("Error handler of task {} failed: {}", task.getId(), handlerError.getMessage(), handlerError);
            }
        }
    }
}
