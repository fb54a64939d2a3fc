package com.garrison.core.model;

/**
 * Stable entity identity of a spawn point. Totally ordered; the lowest id
 * among siblings wins coordinator election.
 */
public record SpawnPointId(long value) implements Comparable<SpawnPointId> {

    @Override
    public int compareTo(SpawnPointId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "SP-" + value;
    }
}
