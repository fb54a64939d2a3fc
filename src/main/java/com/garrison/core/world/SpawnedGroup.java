package com.garrison.core.world;

import java.util.List;

/**
 * A freshly instantiated unit group.
 */
public interface SpawnedGroup extends EntityHandle {

    /**
     * Adds members to the group.
     *
     * @return number of members actually added
     */
    int populate(int memberCount);

    List<AiAgent> agents();

    /**
     * Clears any directive the group carries and assigns a single
     * "defend this position" directive targeting the strongpoint.
     */
    void assignDefendDirective(Strongpoint target);
}
