package com.garrison.core.world;

/**
 * Handle to an entity created by the core. The entity may be destroyed
 * externally at any time; {@link #isValid()} reports that lazily.
 */
public interface EntityHandle {

    String id();

    boolean isValid();

    /** Removes the entity from the simulation. No-op when already gone. */
    void despawn();
}
