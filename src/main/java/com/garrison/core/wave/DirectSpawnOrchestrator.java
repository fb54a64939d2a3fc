package com.garrison.core.wave;

import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;
import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.model.WaveSpec;
import com.garrison.core.world.SpawnedGroup;
import com.garrison.core.world.Strongpoint;
import com.garrison.core.world.WorldQueryFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spawns wave groups directly around the strongpoint.
 *
 * <p>Flow: despawn previous wave -> for each group: find position -> instantiate ->
 * populate -> tune agents -> assign defend directive -> track. A group that fails
 * is skipped and counted; the alert goes out when at least one group made it.
 */
public class DirectSpawnOrchestrator implements WaveOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DirectSpawnOrchestrator.class);

    private final WorldQueryFacade world;
    private final SpawnPositionResolver positions;
    private final AgentTuner tuner;
    private final ReinforcementAlerts alerts;
    private final GarrisonMetrics metrics;

    public DirectSpawnOrchestrator(WorldQueryFacade world, SpawnPositionResolver positions, AgentTuner tuner,
                                   ReinforcementAlerts alerts, GarrisonMetrics metrics) {
        this.world = world;
        this.positions = positions;
        this.tuner = tuner;
        this.alerts = alerts;
        this.metrics = metrics;
    }

    @Override
    public WaveSpawnResult trigger(Strongpoint strongpoint, Faction faction, WaveSpec wave, SpawnedWaveAssets assets) {
        assets.despawnAll();

        var groups = wave.allGroups();
        int requested = groups.size();
        int spawned = 0;
        for (UnitGroupSpec spec : groups) {
            if (spawnGroup(strongpoint, faction, wave, spec, assets)) {
                spawned++;
            }
        }

        var result = new WaveSpawnResult(wave.waveNumber(), requested, spawned, false);
        if (metrics != null) {
            metrics.recordWaveGroups(spawned, result.failedGroups());
        }

        String name = strongpoint != null ? strongpoint.name() : "<unresolved>";
        if (!result.anySpawned()) {
            log.warn("Wave {} at {} spawned no groups ({} requested)", wave.waveNumber(), name, requested);
            return result;
        }
        if (result.isPartial()) {
            log.warn("Wave {} at {} partially spawned: {}/{} groups", wave.waveNumber(), name, spawned, requested);
        } else {
            log.info("Wave {} at {} spawned {} groups", wave.waveNumber(), name, spawned);
        }
        alerts.announce(name, wave.waveNumber());
        return result;
    }

    private boolean spawnGroup(Strongpoint strongpoint, Faction faction, WaveSpec wave,
                               UnitGroupSpec spec, SpawnedWaveAssets assets) {
        if (strongpoint == null) {
            log.warn("Cannot spawn {}: strongpoint unresolved", spec.prefab());
            return false;
        }
        if (faction == null) {
            log.warn("Cannot spawn {} at {}: faction unresolved", spec.prefab(), strongpoint.name());
            return false;
        }
        try {
            Position position = positions.resolve(strongpoint.position(),
                    wave.minSpawnRadius(), wave.maxSpawnRadius());
            var created = world.spawnGroup(spec, faction, position);
            if (created.isEmpty()) {
                log.warn("Failed to load prefab {} for wave {} at {}",
                        spec.prefab(), wave.waveNumber(), strongpoint.name());
                return false;
            }
            SpawnedGroup group = created.get();
            assets.track(group);

            int members = group.populate(spec.memberCount());
            if (members < spec.memberCount()) {
                log.warn("Group {} populated with {}/{} members", spec.prefab(), members, spec.memberCount());
            }
            var tier = tuner.tune(group);
            group.assignDefendDirective(strongpoint);

            log.debug("Spawned {} ({} members, tier {}) at ({}, {})",
                    spec.prefab(), members, tier, (int) position.x(), (int) position.z());
            return true;
        } catch (RuntimeException e) {
            log.warn("Spawning {} for wave {} at {} failed: {}",
                    spec.prefab(), wave.waveNumber(), strongpoint.name(), e.getMessage(), e);
            return false;
        }
    }
}
