package com.garrison.sim;

import com.garrison.core.model.SpawnParameters;
import com.garrison.core.world.SpawnCycleParameters;
import com.garrison.core.world.SpawnPointFramework;

import java.util.ArrayList;
import java.util.List;

/**
 * Stand-in for the host's ordinary respawn framework of one spawn point.
 * Records what each cycle was asked to produce.
 */
public class SimSpawnPointFramework implements SpawnPointFramework {

    private final List<SpawnParameters> cycles = new ArrayList<>();
    private boolean activeGroup;
    private boolean respawnTimerExpired;
    private int despawns;

    @Override
    public boolean hasActiveGroup() {
        return activeGroup;
    }

    @Override
    public void despawnActiveGroup() {
        if (activeGroup) {
            despawns++;
        }
        activeGroup = false;
    }

    @Override
    public void expireRespawnTimer() {
        respawnTimerExpired = true;
    }

    /**
     * Runs one respawn cycle against the spawn point's parameters.
     */
    public SpawnParameters runCycle(SpawnCycleParameters source) {
        SpawnParameters params = source.nextCycle();
        cycles.add(params);
        activeGroup = params.groupCount() > 0;
        respawnTimerExpired = false;
        return params;
    }

    public void setActiveGroup(boolean activeGroup) {
        this.activeGroup = activeGroup;
    }

    public boolean isRespawnTimerExpired() {
        return respawnTimerExpired;
    }

    public int despawns() {
        return despawns;
    }

    public List<SpawnParameters> cycles() {
        return List.copyOf(cycles);
    }
}
