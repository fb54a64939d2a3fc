package com.garrison.core.wave;

import com.garrison.core.scheduler.TickScheduler;
import com.garrison.core.world.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Broadcasts wave-start alerts. Dispatch is delayed slightly so clients have
 * registered the freshly spawned entities before the message arrives.
 */
public class ReinforcementAlerts {

    private static final Logger log = LoggerFactory.getLogger(ReinforcementAlerts.class);

    private final NotificationSink sink;
    private final TickScheduler scheduler;
    private final Duration dispatchDelay;
    private final String title;
    private final String subtitleFormat;
    private final float displaySeconds;

    public ReinforcementAlerts(NotificationSink sink, TickScheduler scheduler, Duration dispatchDelay,
                               String title, String subtitleFormat, float displaySeconds) {
        this.sink = sink;
        this.scheduler = scheduler;
        this.dispatchDelay = dispatchDelay;
        this.title = title;
        this.subtitleFormat = subtitleFormat;
        this.displaySeconds = displaySeconds;
    }

    public void announce(String strongpointName, int waveNumber) {
        scheduler.schedule("reinforcement-alert", dispatchDelay, () -> send(strongpointName, waveNumber));
    }

    private void send(String strongpointName, int waveNumber) {
        String subtitle = String.format(subtitleFormat, strongpointName);
        try {
            sink.broadcast(title, subtitle, displaySeconds);
            log.info("Sent wave {} alert for {}", waveNumber, strongpointName);
        } catch (RuntimeException e) {
            log.warn("Failed to broadcast wave {} alert for {}: {}", waveNumber, strongpointName, e.getMessage());
        }
    }
}
