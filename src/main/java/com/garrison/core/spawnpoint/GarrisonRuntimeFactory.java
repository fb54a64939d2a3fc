package com.garrison.core.spawnpoint;

import com.garrison.core.config.GarrisonProperties;
import com.garrison.core.escalation.WaveTable;
import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.scheduler.TickScheduler;
import com.garrison.core.wave.ReinforcementAlerts;
import com.garrison.core.wave.SpawnPositionResolver;
import com.garrison.core.world.NotificationSink;
import com.garrison.core.world.WorldQueryFacade;

import java.time.Duration;
import java.util.Random;

/**
 * Builds a {@link GarrisonRuntime} around the host's collaborators.
 */
public class GarrisonRuntimeFactory {

    private final GarrisonProperties properties;
    private final WaveTable waves;
    private final GarrisonMetrics metrics;

    public GarrisonRuntimeFactory(GarrisonProperties properties, WaveTable waves, GarrisonMetrics metrics) {
        this.properties = properties;
        this.waves = waves;
        this.metrics = metrics;
    }

    public GarrisonRuntime create(WorldQueryFacade world, TickScheduler scheduler, NotificationSink sink) {
        return create(world, scheduler, sink, new Random());
    }

    /**
     * @param random source for spawn-position selection; seed it for reproducible runs
     */
    public GarrisonRuntime create(WorldQueryFacade world, TickScheduler scheduler, NotificationSink sink,
                                  Random random) {
        var notification = properties.getNotification();
        var alerts = new ReinforcementAlerts(sink, scheduler,
                Duration.ofMillis(notification.getDispatchDelayMs()),
                notification.getTitle(), notification.getSubtitleFormat(), notification.getDisplaySeconds());
        var spawn = properties.getSpawn();
        var positions = new SpawnPositionResolver(world, spawn.getMinSeparation(),
                spawn.getMaxPositionAttempts(), random);
        return new GarrisonRuntime(world, scheduler, properties, metrics, waves, alerts, positions);
    }
}
