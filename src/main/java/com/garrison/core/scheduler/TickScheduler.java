package com.garrison.core.scheduler;

import java.time.Duration;

/**
 * Cooperative timer queue. All callbacks run on a single logical thread;
 * callbacks from different spawn points interleave in due-time order.
 */
public interface TickScheduler {

    /**
     * Runs {@code task} once after {@code delay}.
     *
     * @param name label used in logs and failure metrics
     */
    ScheduledTick schedule(String name, Duration delay, Runnable task);

    /**
     * Runs {@code task} every {@code period}, first run one period from now.
     */
    ScheduledTick scheduleAtFixedRate(String name, Duration period, Runnable task);
}
