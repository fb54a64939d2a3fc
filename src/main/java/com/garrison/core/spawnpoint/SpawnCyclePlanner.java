package com.garrison.core.spawnpoint;

import com.garrison.core.config.GarrisonProperties;
import com.garrison.core.model.SpawnMode;
import com.garrison.core.model.SpawnParameters;
import com.garrison.core.model.SpawnRole;

/**
 * Pure mapping from (role, mode, standing-down) to the parameters of one
 * ordinary respawn cycle.
 */
public class SpawnCyclePlanner {

    private final GarrisonProperties.Spawn spawn;

    public SpawnCyclePlanner(GarrisonProperties.Spawn spawn) {
        this.spawn = spawn;
    }

    public SpawnParameters plan(SpawnRole role, SpawnMode mode, boolean standingDown) {
        var normal = role == SpawnRole.ATTACKER
                ? spawn.getAttacker().toParameters()
                : spawn.getDefender().toParameters();
        if (standingDown) {
            return normal.suppressed();
        }
        if (mode instanceof SpawnMode.Reinforcement reinforcement) {
            return new SpawnParameters(
                    spawn.getReinforcementGroupCount(),
                    spawn.getReinforcementDispersion(),
                    normal.respawnSeconds(),
                    reinforcement.wave().allGroups());
        }
        return normal;
    }
}
