package com.garrison.core.model;

/**
 * Operating mode of a spawn point's ordinary respawn cycle.
 */
public interface SpawnMode {

    SpawnMode NORMAL = new Normal();

    record Normal() implements SpawnMode {}

    /**
     * A queued reinforcement wave to be produced by the next cycle.
     */
    record Reinforcement(WaveSpec wave) implements SpawnMode {}
}
