package com.garrison.core.election;

import com.garrison.core.model.SpawnPointId;
import com.garrison.core.world.Strongpoint;

import java.util.Optional;

/**
 * A spawn point taking part in coordinator election.
 */
public interface CoordinationParticipant {

    SpawnPointId id();

    /** The strongpoint this participant guards, once resolved. */
    Optional<Strongpoint> strongpoint();

    /**
     * Asks the participant to run election again, after the settling delay.
     * Used when a sibling coordinator is destroyed and failover is enabled.
     */
    void requestElection();
}
