package com.garrison.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link TickScheduler} on a single-threaded {@link ScheduledExecutorService},
 * for hosts that tick the core on wall-clock time.
 */
public class ExecutorTickScheduler implements TickScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTickScheduler.class);

    private final ScheduledExecutorService executor;
    private final Consumer<String> failureListener;

    public ExecutorTickScheduler(Consumer<String> failureListener) {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "garrison-tick");
            t.setDaemon(true);
            return t;
        }), failureListener);
    }

    ExecutorTickScheduler(ScheduledExecutorService executor, Consumer<String> failureListener) {
        this.executor = executor;
        this.failureListener = failureListener;
    }

    @Override
    public ScheduledTick schedule(String name, Duration delay, Runnable task) {
        var future = executor.schedule(new GuardedTask(name, task, failureListener),
                delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTick(future);
    }

    @Override
    public ScheduledTick scheduleAtFixedRate(String name, Duration period, Runnable task) {
        long periodMs = period.toMillis();
        var future = executor.scheduleAtFixedRate(new GuardedTask(name, task, failureListener),
                periodMs, periodMs, TimeUnit.MILLISECONDS);
        return new FutureTick(future);
    }

    @Override
    public void close() {
        log.info("Shutting down tick scheduler");
        executor.shutdownNow();
    }

    private record FutureTick(ScheduledFuture<?> future) implements ScheduledTick {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
