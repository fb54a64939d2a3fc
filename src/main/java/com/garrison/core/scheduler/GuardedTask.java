package com.garrison.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Wraps a scheduled callback so that an exception is logged and counted
 * instead of cancelling the schedule or reaching the timer thread.
 */
public final class GuardedTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(GuardedTask.class);

    private final String name;
    private final Runnable delegate;
    private final Consumer<String> failureListener;

    public GuardedTask(String name, Runnable delegate, Consumer<String> failureListener) {
        this.name = name;
        this.delegate = delegate;
        this.failureListener = failureListener;
    }

    public String name() {
        return name;
    }

    @Override
    public void run() {
        try {
            delegate.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task '{}' failed: {}", name, e.getMessage(), e);
            if (failureListener != null) {
                failureListener.accept(name);
            }
        }
    }
}
