package com.garrison.core.world;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;
import com.garrison.core.model.UnitGroupSpec;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the host simulation plus the few write operations the
 * reinforcement core needs (spawning groups). Implemented by the host.
 *
 * <p>Unavailable collaborators are reported as empty {@link Optional}s rather
 * than exceptions so callers can decide between failing open and failing closed.
 */
public interface WorldQueryFacade {

    /** Current simulation timestamp. */
    Instant now();

    /**
     * Live actors that may count as attackers (player-controlled entities).
     * Empty when the player registry is not available.
     */
    Optional<List<Actor>> actors();

    /**
     * All capturable strongpoints. Empty when the game mode or faction
     * manager cannot be resolved.
     */
    Optional<List<Strongpoint>> strongpoints();

    /** Total connected participant count. */
    int playerCount();

    /**
     * Terrain-safe positions inside the ring {@code [minRadius, maxRadius]} around {@code center}.
     *
     * @param minSeparation minimum distance from obstacles and other entities
     * @param maxAttempts   sampling attempts before giving up
     * @return candidates, possibly empty
     */
    List<Position> findEmptyPositions(Position center, double minRadius, double maxRadius,
                                      double minSeparation, int maxAttempts);

    /**
     * Instantiates an empty group from a prefab for the given faction.
     * Empty when the prefab cannot be loaded.
     */
    Optional<SpawnedGroup> spawnGroup(UnitGroupSpec spec, Faction faction, Position position);
}
