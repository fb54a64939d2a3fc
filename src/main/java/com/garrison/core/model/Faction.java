package com.garrison.core.model;

/**
 * A side in the simulation. Compared by identity: two factions are the same
 * only if they are the same instance handed out by the world.
 */
public final class Faction {

    private final String key;

    public Faction(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
