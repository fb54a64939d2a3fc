package com.garrison.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Configuration of one escalation tier.
 *
 * @param waveNumber       1-based tier number
 * @param groups           ground groups spawned by this wave
 * @param aerialAsset      optional aerial group spawned after the ground groups (nullable)
 * @param minSpawnRadius   inner radius of the spawn ring around the strongpoint, meters
 * @param maxSpawnRadius   outer radius of the spawn ring, meters
 * @param thresholdSeconds seconds of continuous combat before this wave may fire
 */
public record WaveSpec(
    int waveNumber,
    List<UnitGroupSpec> groups,
    UnitGroupSpec aerialAsset,
    double minSpawnRadius,
    double maxSpawnRadius,
    int thresholdSeconds
) {

    public WaveSpec {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public Optional<UnitGroupSpec> aerial() {
        return Optional.ofNullable(aerialAsset);
    }

    /**
     * Ground groups followed by the aerial asset, in spawn order.
     */
    public List<UnitGroupSpec> allGroups() {
        var all = new ArrayList<UnitGroupSpec>(groups);
        if (aerialAsset != null) {
            all.add(aerialAsset);
        }
        return all;
    }
}
