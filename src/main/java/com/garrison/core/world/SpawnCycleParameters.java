package com.garrison.core.world;

import com.garrison.core.model.SpawnParameters;

/**
 * Read by the base framework at the start of each respawn cycle.
 */
@FunctionalInterface
public interface SpawnCycleParameters {

    /**
     * Parameters for the cycle about to run. May consume a one-shot
     * reinforcement, so call exactly once per cycle.
     */
    SpawnParameters nextCycle();
}
