package com.garrison.sim;

import com.garrison.core.scheduler.GuardedTask;
import com.garrison.core.scheduler.ScheduledTick;
import com.garrison.core.scheduler.TickScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.PriorityQueue;
import java.util.function.Consumer;

/**
 * {@link TickScheduler} on a virtual clock. Nothing runs until the clock is
 * advanced; due callbacks then run in due-time order, ties in scheduling order.
 */
public class ManualTickScheduler implements TickScheduler {

    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private final Consumer<String> failureListener;
    private Instant now;
    private long sequence;

    public ManualTickScheduler(Instant start) {
        this(start, null);
    }

    public ManualTickScheduler(Instant start, Consumer<String> failureListener) {
        this.now = start;
        this.failureListener = failureListener;
    }

    public Instant now() {
        return now;
    }

    @Override
    public ScheduledTick schedule(String name, Duration delay, Runnable task) {
        var entry = new Entry(new GuardedTask(name, task, failureListener), now.plus(delay), null, sequence++);
        queue.add(entry);
        return entry;
    }

    @Override
    public ScheduledTick scheduleAtFixedRate(String name, Duration period, Runnable task) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        var entry = new Entry(new GuardedTask(name, task, failureListener), now.plus(period), period, sequence++);
        queue.add(entry);
        return entry;
    }

    public void advanceBy(Duration duration) {
        advanceTo(now.plus(duration));
    }

    /**
     * Moves the clock to {@code target}, running every callback due on the way.
     */
    public void advanceTo(Instant target) {
        while (!queue.isEmpty() && !queue.peek().dueAt.isAfter(target)) {
            Entry entry = queue.poll();
            if (entry.cancelled) continue;
            now = entry.dueAt;
            entry.task.run();
            if (entry.period != null && !entry.cancelled) {
                entry.dueAt = entry.dueAt.plus(entry.period);
                entry.order = sequence++;
                queue.add(entry);
            }
        }
        if (target.isAfter(now)) {
            now = target;
        }
    }

    /** Scheduled callbacks not yet cancelled. */
    public long pendingCount() {
        return queue.stream().filter(e -> !e.cancelled).count();
    }

    public long pendingCount(String name) {
        return queue.stream().filter(e -> !e.cancelled && e.task.name().equals(name)).count();
    }

    private static final class Entry implements ScheduledTick, Comparable<Entry> {
        private final GuardedTask task;
        private final Duration period;
        private Instant dueAt;
        private long order;
        private boolean cancelled;

        private Entry(GuardedTask task, Instant dueAt, Duration period, long order) {
            this.task = task;
            this.dueAt = dueAt;
            this.period = period;
            this.order = order;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public int compareTo(Entry other) {
            int byTime = dueAt.compareTo(other.dueAt);
            return byTime != 0 ? byTime : Long.compare(order, other.order);
        }
    }
}
