package com.garrison.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutorTickSchedulerTest {

    @Test
    @DisplayName("fixed-rate ticks start after one period and are guarded")
    void fixedRate() {
        ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(executor).scheduleAtFixedRate(any(), anyLong(), anyLong(), any());
        List<String> failures = new ArrayList<>();

        var scheduler = new ExecutorTickScheduler(executor, failures::add);
        scheduler.scheduleAtFixedRate("escalation-check", Duration.ofSeconds(10), () -> {
            throw new IllegalStateException("boom");
        });

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).scheduleAtFixedRate(task.capture(), eq(10_000L), eq(10_000L), eq(TimeUnit.MILLISECONDS));
        assertInstanceOf(GuardedTask.class, task.getValue());
        task.getValue().run();
        assertEquals(List.of("escalation-check"), failures);
    }

    @Test
    @DisplayName("cancel does not interrupt a running tick")
    void cancel() {
        ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(executor).schedule(any(Runnable.class), anyLong(), any());
        when(future.isCancelled()).thenReturn(true);

        var tick = new ExecutorTickScheduler(executor, null)
                .schedule("coordinator-election", Duration.ofMillis(5000), () -> {});
        tick.cancel();

        verify(future).cancel(false);
        assertTrue(tick.isCancelled());
    }

    @Test
    @DisplayName("runs a one-shot tick on the real executor")
    void realExecutor() throws InterruptedException {
        var latch = new CountDownLatch(1);
        try (var scheduler = new ExecutorTickScheduler(null)) {
            scheduler.schedule("reinforcement-alert", Duration.ofMillis(10), latch::countDown);
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }
}
