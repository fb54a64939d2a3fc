package com.garrison.core.wave;

/**
 * Outcome of one wave trigger.
 *
 * @param waveNumber      wave that was triggered
 * @param requestedGroups groups the wave asked for, aerial asset included
 * @param spawnedGroups   groups created (or queued, when deferred)
 * @param deferred        true when the base framework's next cycle will do the spawning
 */
public record WaveSpawnResult(int waveNumber, int requestedGroups, int spawnedGroups, boolean deferred) {

    public boolean isPartial() {
        return spawnedGroups > 0 && spawnedGroups < requestedGroups;
    }

    public boolean anySpawned() {
        return spawnedGroups > 0;
    }

    public int failedGroups() {
        return requestedGroups - spawnedGroups;
    }
}
