package com.garrison.core.world;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;

public interface Actor {

    Position position();

    boolean isAlive();

    /** Faction of the actor, or {@code null} when it has none. */
    Faction faction();
}
