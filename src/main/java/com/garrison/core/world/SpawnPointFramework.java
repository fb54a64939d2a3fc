package com.garrison.core.world;

/**
 * Hooks into the host's ordinary patrol/spawn-point framework for one spawn point.
 * The framework owns the standing group and its periodic respawn cycle.
 */
public interface SpawnPointFramework {

    boolean hasActiveGroup();

    /** Despawns the standing group, if any. */
    void despawnActiveGroup();

    /** Makes the next framework update run a respawn cycle immediately. */
    void expireRespawnTimer();
}
