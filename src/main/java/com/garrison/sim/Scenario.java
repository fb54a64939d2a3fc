package com.garrison.sim;

/**
 * A single-strongpoint assault played on the virtual clock.
 *
 * @param spawnPoints   defender spawn points guarding the strongpoint
 * @param attackSeconds how long one attacker stays inside the detection radius
 * @param totalSeconds  total simulated time after election
 * @param players       connected player count, drives skill tuning
 * @param seed          seed for spawn-position selection
 */
public record Scenario(int spawnPoints, int attackSeconds, int totalSeconds, int players, long seed) {

    public Scenario {
        if (spawnPoints < 1) {
            throw new IllegalArgumentException("At least one spawn point is required");
        }
        if (attackSeconds < 0 || totalSeconds < attackSeconds) {
            throw new IllegalArgumentException("Attack must fit inside the total duration");
        }
    }
}
