package com.garrison.core.wave;

import com.garrison.core.model.Faction;
import com.garrison.core.model.WaveSpec;
import com.garrison.core.world.Strongpoint;

/**
 * Materializes a fired wave at a strongpoint.
 */
public interface WaveOrchestrator {

    /**
     * Replaces the previous wave's entities with the given wave.
     *
     * @param strongpoint position to reinforce; {@code null} aborts every group
     * @param faction     faction the reinforcements belong to
     * @param wave        wave to spawn
     * @param assets      coordinator-owned tracking of the previous wave, refilled with this one
     */
    WaveSpawnResult trigger(Strongpoint strongpoint, Faction faction, WaveSpec wave, SpawnedWaveAssets assets);
}
