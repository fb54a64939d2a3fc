package com.garrison.core.spawnpoint;

import com.garrison.core.model.Faction;
import com.garrison.core.model.SpawnMode;
import com.garrison.core.model.SpawnParameters;
import com.garrison.core.model.SpawnPointId;
import com.garrison.core.model.SpawnRole;
import com.garrison.core.wave.AgentTuner;
import com.garrison.core.world.SpawnCycleParameters;
import com.garrison.core.world.SpawnedGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spawn point feeding an attack on a strongpoint. It never escalates; it only
 * runs its own ordinary cycle with the attacker parameters.
 */
public class AttackerSpawnPoint implements SpawnCycleParameters {

    private static final Logger log = LoggerFactory.getLogger(AttackerSpawnPoint.class);

    private final SpawnPointId id;
    private final Faction faction;
    private final SpawnCyclePlanner planner;
    private final AgentTuner tuner;

    AttackerSpawnPoint(SpawnPointId id, Faction faction, SpawnCyclePlanner planner, AgentTuner tuner) {
        this.id = id;
        this.faction = faction;
        this.planner = planner;
        this.tuner = tuner;
        var params = planner.plan(SpawnRole.ATTACKER, SpawnMode.NORMAL, false);
        log.info("Attacker spawn point {} ({}) initialized - respawn {}s, groups {}",
                id, faction, params.respawnSeconds(), params.groupCount());
    }

    public SpawnPointId id() {
        return id;
    }

    public Faction faction() {
        return faction;
    }

    @Override
    public SpawnParameters nextCycle() {
        return planner.plan(SpawnRole.ATTACKER, SpawnMode.NORMAL, false);
    }

    public void onStandingGroupSpawned(SpawnedGroup group) {
        tuner.tune(group);
    }
}
