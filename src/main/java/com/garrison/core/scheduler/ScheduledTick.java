package com.garrison.core.scheduler;

/**
 * Handle for a scheduled callback.
 */
public interface ScheduledTick {

    void cancel();

    boolean isCancelled();
}
