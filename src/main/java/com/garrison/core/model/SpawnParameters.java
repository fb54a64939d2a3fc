package com.garrison.core.model;

import java.util.List;

/**
 * What the base spawn-point framework should produce on one respawn cycle.
 *
 * @param groupCount       number of groups to spawn (0 suppresses the cycle)
 * @param dispersionRadius spawn dispersion around the spawn point, meters
 * @param respawnSeconds   delay before the following cycle
 * @param composition      group prefabs to cycle through; empty means the framework default
 */
public record SpawnParameters(
    int groupCount,
    double dispersionRadius,
    int respawnSeconds,
    List<UnitGroupSpec> composition
) {

    public SpawnParameters {
        composition = composition == null ? List.of() : List.copyOf(composition);
    }

    public SpawnParameters suppressed() {
        return new SpawnParameters(0, dispersionRadius, respawnSeconds, composition);
    }
}
