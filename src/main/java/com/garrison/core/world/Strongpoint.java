package com.garrison.core.world;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;

/**
 * A capturable base. Read-only to the reinforcement core.
 */
public interface Strongpoint {

    String id();

    String name();

    /** Controlling faction, or {@code null} when uncontrolled. */
    Faction faction();

    Position position();
}
