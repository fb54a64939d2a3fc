package com.garrison.core.model;

/**
 * One group to spawn as part of a wave.
 *
 * @param prefab      prefab resource name the world instantiates
 * @param memberCount number of agents placed in the group
 * @param aerial      true for an aerial asset (vehicle with crew)
 */
public record UnitGroupSpec(String prefab, int memberCount, boolean aerial) {

    public static UnitGroupSpec ground(String prefab, int memberCount) {
        return new UnitGroupSpec(prefab, memberCount, false);
    }

    public static UnitGroupSpec air(String prefab, int memberCount) {
        return new UnitGroupSpec(prefab, memberCount, true);
    }
}
