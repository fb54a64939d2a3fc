package com.garrison.core.election;

import com.garrison.core.model.SpawnPointId;
import com.garrison.core.world.Strongpoint;

import java.util.Optional;

/**
 * Picks the single coordinator of a strongpoint: the registered participant
 * bound to it with the lowest {@link SpawnPointId}. Every participant computes
 * the same answer on its own, so no central authority is needed.
 */
public class CoordinatorElector {

    private final SpawnPointRegistry registry;

    public CoordinatorElector(SpawnPointRegistry registry) {
        this.registry = registry;
    }

    /**
     * Lowest identity among registered participants guarding {@code strongpoint}.
     */
    public Optional<SpawnPointId> coordinatorFor(Strongpoint strongpoint) {
        if (strongpoint == null) {
            return Optional.empty();
        }
        SpawnPointId lowest = null;
        for (CoordinationParticipant candidate : registry.all()) {
            var theirs = candidate.strongpoint();
            if (theirs.isEmpty() || !sameStrongpoint(theirs.get(), strongpoint)) continue;
            if (lowest == null || candidate.id().compareTo(lowest) < 0) {
                lowest = candidate.id();
            }
        }
        return Optional.ofNullable(lowest);
    }

    /**
     * Whether {@code participant} should coordinate its strongpoint. A participant
     * that has not resolved a strongpoint never coordinates.
     */
    public boolean isCoordinator(CoordinationParticipant participant) {
        var strongpoint = participant.strongpoint();
        if (strongpoint.isEmpty()) {
            return false;
        }
        var winner = coordinatorFor(strongpoint.get());
        // A participant missing from the registry still competes against its siblings.
        return winner.isEmpty() || participant.id().compareTo(winner.get()) <= 0;
    }

    static boolean sameStrongpoint(Strongpoint a, Strongpoint b) {
        return a == b || a.id().equals(b.id());
    }
}
