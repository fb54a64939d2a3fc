package com.garrison.core.wave;

import com.garrison.core.model.Faction;
import com.garrison.core.model.WaveSpec;
import com.garrison.core.world.SpawnPointFramework;
import com.garrison.core.world.Strongpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Lets the base framework's ordinary respawn cycle produce the wave: the
 * standing group is cleared, the wave is queued on the spawn point, and the
 * respawn timer is expired so the next framework update spawns it.
 */
public class RespawnCycleOrchestrator implements WaveOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RespawnCycleOrchestrator.class);

    private final SpawnPointFramework framework;
    private final Predicate<WaveSpec> reinforcementQueue;
    private final ReinforcementAlerts alerts;

    /**
     * @param reinforcementQueue receives the wave so the next cycle's parameters reflect it;
     *                           returns {@code false} when the spawn point cannot run a cycle
     */
    public RespawnCycleOrchestrator(SpawnPointFramework framework, Predicate<WaveSpec> reinforcementQueue,
                                    ReinforcementAlerts alerts) {
        this.framework = framework;
        this.reinforcementQueue = reinforcementQueue;
        this.alerts = alerts;
    }

    @Override
    public WaveSpawnResult trigger(Strongpoint strongpoint, Faction faction, WaveSpec wave, SpawnedWaveAssets assets) {
        int requested = wave.allGroups().size();
        if (strongpoint == null || faction == null) {
            log.warn("Cannot queue wave {}: strongpoint or faction unresolved", wave.waveNumber());
            return new WaveSpawnResult(wave.waveNumber(), requested, 0, true);
        }

        assets.despawnAll();
        if (!reinforcementQueue.test(wave)) {
            log.warn("Wave {} at {} not queued: spawn point is not running cycles", wave.waveNumber(), strongpoint.name());
            return new WaveSpawnResult(wave.waveNumber(), requested, 0, true);
        }
        if (framework.hasActiveGroup()) {
            log.info("Despawning standing group at {} to make room for wave {}", strongpoint.name(), wave.waveNumber());
            framework.despawnActiveGroup();
        }
        framework.expireRespawnTimer();

        log.info("Wave {} queued at {} - {} groups on next spawn cycle", wave.waveNumber(), strongpoint.name(), requested);
        alerts.announce(strongpoint.name(), wave.waveNumber());
        return new WaveSpawnResult(wave.waveNumber(), requested, requested, true);
    }
}
