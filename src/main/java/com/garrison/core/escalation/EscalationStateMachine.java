package com.garrison.core.escalation;

import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.model.WaveSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns a per-tick combat signal into at most one wave decision.
 *
 * <p>States: idle (inactive, wave 0) and engaged (active, wave 0..max).
 * Disengaging is a full reset, so a later engagement restarts the timeline.
 * While engaged, waves are checked from the highest number down and the first
 * one that is ahead of the current wave and whose threshold has elapsed fires.
 * A long fight therefore jumps straight to the right tier instead of replaying
 * the lower ones.
 */
public class EscalationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(EscalationStateMachine.class);

    private final String strongpointName;
    private final WaveTable waves;
    private final Duration cooldown;
    private final GarrisonMetrics metrics;
    private final CombatState state = new CombatState();

    public EscalationStateMachine(String strongpointName, WaveTable waves, Duration cooldown,
                                  GarrisonMetrics metrics) {
        this.strongpointName = strongpointName;
        this.waves = waves;
        this.cooldown = cooldown;
        this.metrics = metrics;
    }

    public CombatState state() {
        return state;
    }

    /**
     * Advances the machine by one tick.
     *
     * @param combatActive detector output for this tick
     * @param now          simulation time of this tick
     * @return the wave to trigger now, if any
     */
    public Optional<WaveSpec> evaluate(boolean combatActive, Instant now) {
        if (!combatActive) {
            if (state.isActive()) {
                var duration = Duration.between(state.combatStartTime().orElse(now), now);
                int reached = state.currentWave();
                state.disengage();
                log.info("Combat ended at {} after {}s (reached wave {}) - reset",
                        strongpointName, duration.toSeconds(), reached);
                if (metrics != null) {
                    metrics.recordEngagementEnded(duration);
                }
            }
            return Optional.empty();
        }

        if (!state.isActive()) {
            state.engage(now);
            log.info("Combat detected at {} - tracking started", strongpointName);
            if (metrics != null) {
                metrics.recordEngagementStarted();
            }
        }

        var lastWave = state.lastWaveTime();
        if (lastWave.isPresent() && Duration.between(lastWave.get(), now).compareTo(cooldown) < 0) {
            log.debug("Wave cooldown active at {}", strongpointName);
            return Optional.empty();
        }

        long elapsed = Duration.between(state.combatStartTime().orElseThrow(), now).toSeconds();
        for (WaveSpec wave : waves.highestFirst()) {
            if (wave.waveNumber() <= state.currentWave()) {
                break;
            }
            if (wave.thresholdSeconds() <= elapsed) {
                state.recordWave(wave.waveNumber(), now);
                log.info("Wave {} triggered at {} after {}s of combat",
                        wave.waveNumber(), strongpointName, elapsed);
                if (metrics != null) {
                    metrics.recordWaveTriggered(wave.waveNumber());
                }
                return Optional.of(wave);
            }
        }
        return Optional.empty();
    }

    public boolean isAtMaxWave() {
        return state.currentWave() >= waves.maxWave();
    }
}
