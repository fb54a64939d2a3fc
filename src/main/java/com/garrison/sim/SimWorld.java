package com.garrison.sim;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;
import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.world.Actor;
import com.garrison.core.world.SpawnedGroup;
import com.garrison.core.world.Strongpoint;
import com.garrison.core.world.WorldQueryFacade;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * In-memory {@link WorldQueryFacade} for scenario runs and tests. Time comes
 * from the supplied clock, usually a {@link ManualTickScheduler}.
 */
public class SimWorld implements WorldQueryFacade {

    private final Supplier<Instant> clock;
    private final List<Actor> actors = new ArrayList<>();
    private final List<Strongpoint> strongpoints = new ArrayList<>();
    private final List<SimGroup> spawned = new ArrayList<>();
    private final Set<String> brokenPrefabs = new HashSet<>();
    private boolean actorRegistryAvailable = true;
    private boolean strongpointRegistryAvailable = true;
    private boolean terrainBlocked;
    private int playerCount;
    private int nextGroupId = 1;

    public SimWorld(Supplier<Instant> clock) {
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return clock.get();
    }

    @Override
    public Optional<List<Actor>> actors() {
        return actorRegistryAvailable ? Optional.of(List.copyOf(actors)) : Optional.empty();
    }

    @Override
    public Optional<List<Strongpoint>> strongpoints() {
        return strongpointRegistryAvailable ? Optional.of(List.copyOf(strongpoints)) : Optional.empty();
    }

    @Override
    public int playerCount() {
        return playerCount;
    }

    /**
     * Four candidates on the middle of the ring, or none when terrain is blocked.
     */
    @Override
    public List<Position> findEmptyPositions(Position center, double minRadius, double maxRadius,
                                             double minSeparation, int maxAttempts) {
        if (terrainBlocked || maxAttempts <= 0) {
            return List.of();
        }
        double r = (minRadius + maxRadius) / 2.0;
        return List.of(
                center.offset(r, 0), center.offset(0, r),
                center.offset(-r, 0), center.offset(0, -r));
    }

    @Override
    public Optional<SpawnedGroup> spawnGroup(UnitGroupSpec spec, Faction faction, Position position) {
        if (brokenPrefabs.contains(spec.prefab())) {
            return Optional.empty();
        }
        var group = new SimGroup("G-" + nextGroupId++, spec, faction, position);
        spawned.add(group);
        return Optional.of(group);
    }

    public SimStrongpoint addStrongpoint(SimStrongpoint strongpoint) {
        strongpoints.add(strongpoint);
        return strongpoint;
    }

    public SimActor addActor(SimActor actor) {
        actors.add(actor);
        return actor;
    }

    public void removeActor(Actor actor) {
        actors.remove(actor);
    }

    public List<SimGroup> spawnedGroups() {
        return List.copyOf(spawned);
    }

    public List<SimGroup> liveGroups() {
        return spawned.stream().filter(SimGroup::isValid).toList();
    }

    public void breakPrefab(String prefab) {
        brokenPrefabs.add(prefab);
    }

    public void setPlayerCount(int playerCount) {
        this.playerCount = playerCount;
    }

    public void setActorRegistryAvailable(boolean available) {
        this.actorRegistryAvailable = available;
    }

    public void setStrongpointRegistryAvailable(boolean available) {
        this.strongpointRegistryAvailable = available;
    }

    public void setTerrainBlocked(boolean blocked) {
        this.terrainBlocked = blocked;
    }
}
