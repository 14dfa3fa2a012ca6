package com.autonomous.gateway.scheduler;

/**
 * Anything a {@link TaskScheduler} can run on a fixed interval.
 */
public interface ScheduledTask {

    String getId();

    /** Delay between ticks; always positive. */
    long getIntervalSeconds();

    /** Whether the first tick runs right after start instead of after one interval. */
    boolean isExecuteImmediately();

    long getCreatedAt();
}
