package com.garrison.core.model;

/**
 * How a fired wave reaches the world.
 */
public enum WaveDeliveryStrategy {
    /** Spawn the wave's groups directly around the strongpoint. */
    DIRECT_SPAWN,
    /** Queue the wave on the spawn point and let the base framework's next respawn cycle create it. */
    RESPAWN_CYCLE
}
