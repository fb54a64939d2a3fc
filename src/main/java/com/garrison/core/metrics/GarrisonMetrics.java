package com.garrison.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for reinforcement coordination.
 */
public class GarrisonMetrics {

    private final MeterRegistry registry;

    public GarrisonMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordElection(boolean coordinator) {
        Counter.builder("garrison.coordinator.elections")
                .tag("role", coordinator ? "coordinator" : "follower")
                .register(registry)
                .increment();
    }

    public void recordEngagementStarted() {
        Counter.builder("garrison.combat.engagements")
                .register(registry)
                .increment();
    }

    public void recordEngagementEnded(Duration duration) {
        Timer.builder("garrison.combat.duration")
                .register(registry)
                .record(duration);
    }

    public void recordWaveTriggered(int waveNumber) {
        Counter.builder("garrison.waves.triggered")
                .tag("wave", String.valueOf(waveNumber))
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of every group requested by one wave.
     *
     * @param spawned groups that were created
     * @param failed  groups that could not be created
     */
    public void recordWaveGroups(int spawned, int failed) {
        Counter.builder("garrison.wave.groups")
                .description("Reinforcement groups requested by waves, by outcome")
                .tag("outcome", "spawned")
                .register(registry)
                .increment(spawned);
        Counter.builder("garrison.wave.groups")
                .description("Reinforcement groups requested by waves, by outcome")
                .tag("outcome", "failed")
                .register(registry)
                .increment(failed);
    }

    public void recordTeardown() {
        Counter.builder("garrison.lifecycle.teardowns")
                .register(registry)
                .increment();
    }

    public void recordTickFailure(String task) {
        Counter.builder("garrison.tick.failures")
                .tag("task", task)
                .register(registry)
                .increment();
    }
}
