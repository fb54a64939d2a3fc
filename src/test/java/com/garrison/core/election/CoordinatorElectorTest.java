package com.garrison.core.election;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;
import com.garrison.core.model.SpawnPointId;
import com.garrison.core.world.Strongpoint;
import com.garrison.sim.SimStrongpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorElectorTest {

    private record Participant(SpawnPointId id, Strongpoint bound) implements CoordinationParticipant {

        @Override
        public Optional<Strongpoint> strongpoint() {
            return Optional.ofNullable(bound);
        }

        @Override
        public void requestElection() {
        }
    }

    private final Faction opfor = new Faction("OPFOR");
    private final Strongpoint kilo = new SimStrongpoint("SP-KILO", "Outpost Kilo", opfor, new Position(0, 0, 0));
    private final Strongpoint lima = new SimStrongpoint("SP-LIMA", "Firebase Lima", opfor, new Position(900, 0, 0));

    private SpawnPointRegistry registry;
    private CoordinatorElector elector;

    @BeforeEach
    void setUp() {
        registry = new SpawnPointRegistry();
        elector = new CoordinatorElector(registry);
    }

    private Participant register(long id, Strongpoint sp) {
        var p = new Participant(new SpawnPointId(id), sp);
        registry.register(p);
        return p;
    }

    @Test
    @DisplayName("lowest id wins regardless of registration order")
    void lowestIdWins() {
        var high = register(30, kilo);
        var low = register(10, kilo);
        var mid = register(20, kilo);

        assertEquals(Optional.of(new SpawnPointId(10)), elector.coordinatorFor(kilo));
        assertTrue(elector.isCoordinator(low));
        assertFalse(elector.isCoordinator(mid));
        assertFalse(elector.isCoordinator(high));
    }

    @Test
    @DisplayName("each strongpoint gets exactly one coordinator")
    void onePerStrongpoint() {
        var all = List.of(register(5, kilo), register(7, kilo), register(3, lima), register(9, lima));

        var coordinators = all.stream().filter(elector::isCoordinator).collect(Collectors.toList());
        assertEquals(2, coordinators.size());
        assertEquals(new SpawnPointId(5), coordinators.stream().filter(p -> p.bound() == kilo).findFirst().orElseThrow().id());
        assertEquals(new SpawnPointId(3), coordinators.stream().filter(p -> p.bound() == lima).findFirst().orElseThrow().id());
    }

    @Test
    @DisplayName("strongpoints match by id as well as by reference")
    void matchesById() {
        var sameKilo = new SimStrongpoint("SP-KILO", "Outpost Kilo", opfor, new Position(0, 0, 0));
        register(4, kilo);
        var other = register(2, sameKilo);
        assertTrue(elector.isCoordinator(other));
        assertEquals(Optional.of(new SpawnPointId(2)), elector.coordinatorFor(kilo));
    }

    @Test
    @DisplayName("unresolved participants never coordinate and are not counted")
    void unresolved() {
        var unresolved = register(1, null);
        var resolved = register(2, kilo);
        assertFalse(elector.isCoordinator(unresolved));
        assertTrue(elector.isCoordinator(resolved));
        assertTrue(elector.coordinatorFor(null).isEmpty());
    }

    @Test
    @DisplayName("unregistering the winner hands the role to the next lowest")
    void unregister() {
        register(1, kilo);
        var second = register(2, kilo);
        registry.unregister(new SpawnPointId(1));
        assertTrue(elector.isCoordinator(second));
        assertEquals(1, registry.size());
        assertFalse(registry.contains(new SpawnPointId(1)));
    }

    @Test
    @DisplayName("an unregistered participant still competes against its siblings")
    void unregisteredParticipant() {
        register(5, kilo);
        var outsiderLow = new Participant(new SpawnPointId(1), kilo);
        var outsiderHigh = new Participant(new SpawnPointId(9), kilo);
        assertTrue(elector.isCoordinator(outsiderLow));
        assertFalse(elector.isCoordinator(outsiderHigh));
    }
}
