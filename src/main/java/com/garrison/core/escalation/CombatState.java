package com.garrison.core.escalation;

import java.time.Instant;
import java.util.Optional;

/**
 * Escalation bookkeeping for one strongpoint, owned by its coordinator.
 *
 * <p>{@code combatStartTime} is present exactly when the state is active.
 * {@code lastWaveTime} survives a disengage so the wave cooldown also spans
 * back-to-back engagements.
 */
public class CombatState {

    private boolean active;
    private Instant combatStartTime;
    private Instant lastWaveTime;
    private int currentWave;

    public boolean isActive() {
        return active;
    }

    public Optional<Instant> combatStartTime() {
        return Optional.ofNullable(combatStartTime);
    }

    public Optional<Instant> lastWaveTime() {
        return Optional.ofNullable(lastWaveTime);
    }

    public int currentWave() {
        return currentWave;
    }

    void engage(Instant now) {
        active = true;
        combatStartTime = now;
    }

    void disengage() {
        active = false;
        combatStartTime = null;
        currentWave = 0;
    }

    void recordWave(int waveNumber, Instant now) {
        if (!active) {
            throw new IllegalStateException("Cannot record wave " + waveNumber + " while disengaged");
        }
        if (waveNumber <= currentWave) {
            throw new IllegalStateException("Wave " + waveNumber + " does not advance past " + currentWave);
        }
        currentWave = waveNumber;
        lastWaveTime = now;
    }

    @Override
    public String toString() {
        return "CombatState[active=" + active + ", start=" + combatStartTime
                + ", lastWave=" + lastWaveTime + ", wave=" + currentWave + "]";
    }
}
