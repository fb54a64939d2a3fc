package com.garrison.core.wave;

import com.garrison.core.model.Position;
import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.world.EntityHandle;
import com.garrison.sim.SimGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpawnedWaveAssetsTest {

    private SpawnedWaveAssets assets;

    @BeforeEach
    void setUp() {
        assets = new SpawnedWaveAssets();
    }

    private static SimGroup group(String id) {
        return new SimGroup(id, UnitGroupSpec.ground("Group_FireTeam", 4), null, new Position(0, 0, 0));
    }

    @Test
    @DisplayName("despawnAll removes every live entity and empties the collection")
    void despawnAll() {
        var a = group("G-1");
        var b = group("G-2");
        assets.track(a);
        assets.track(b);

        assertEquals(2, assets.despawnAll());
        assertTrue(assets.isEmpty());
        assertFalse(a.isValid());
        assertFalse(b.isValid());
    }

    @Test
    @DisplayName("despawnAll is idempotent")
    void idempotent() {
        var a = group("G-1");
        assets.track(a);
        assets.despawnAll();
        assertEquals(0, assets.despawnAll());
        assertEquals(1, a.despawnCount());
    }

    @Test
    @DisplayName("entities already destroyed are skipped, not despawned")
    void skipsDestroyed() {
        var alive = group("G-1");
        var dead = group("G-2");
        dead.destroy();
        assets.track(alive);
        assets.track(dead);

        assertEquals(1, assets.despawnAll());
        assertEquals(0, dead.despawnCount());
    }

    @Test
    @DisplayName("an entity vanishing mid-despawn does not stop the sweep")
    void vanishingEntity() {
        EntityHandle flaky = mock(EntityHandle.class);
        when(flaky.isValid()).thenReturn(true);
        when(flaky.id()).thenReturn("G-9");
        doThrow(new IllegalStateException("gone")).when(flaky).despawn();
        var after = group("G-10");
        assets.track(flaky);
        assets.track(after);

        assertEquals(1, assets.despawnAll());
        assertFalse(after.isValid());
        assertTrue(assets.isEmpty());
    }

    @Test
    @DisplayName("pruneInvalid drops handles destroyed externally and keeps order")
    void prune() {
        var a = group("G-1");
        var b = group("G-2");
        var c = group("G-3");
        assets.track(a);
        assets.track(b);
        assets.track(c);
        b.destroy();

        assertEquals(1, assets.pruneInvalid());
        assertEquals(2, assets.size());
        assertSame(a, assets.handles().get(0));
        assertSame(c, assets.handles().get(1));
        assertEquals(0, assets.pruneInvalid());
    }
}
