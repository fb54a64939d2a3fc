package com.garrison.sim;

import com.garrison.core.config.GarrisonProperties;
import com.garrison.core.escalation.WaveTable;
import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.model.SpawnPointId;
import com.garrison.core.model.WaveDeliveryStrategy;
import com.garrison.core.spawnpoint.GarrisonRuntimeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioRunnerTest {

    private static ScenarioRunner runner(GarrisonProperties properties) {
        return new ScenarioRunner(new GarrisonRuntimeFactory(properties, WaveTable.of(properties.waveSpecs()),
                new GarrisonMetrics(new SimpleMeterRegistry())));
    }

    @Test
    @DisplayName("default assault reaches wave two and resets once the attacker leaves")
    void defaultAssault() {
        var report = runner(new GarrisonProperties()).run(new Scenario(3, 700, 800, 4, 42));

        assertEquals(new SpawnPointId(1001), report.coordinator());
        assertEquals(List.of(
                new ScenarioReport.WaveEvent(305, 1, 2),
                new ScenarioReport.WaveEvent(605, 2, 2)), report.waves());
        assertEquals(2, report.notifications().size());
        assertFalse(report.combatActiveAtEnd());
        assertEquals(0, report.finalWave());
    }

    @Test
    @DisplayName("short run ends mid-combat")
    void endsInCombat() {
        var report = runner(new GarrisonProperties()).run(new Scenario(1, 400, 400, 4, 1));
        assertEquals(1, report.waves().size());
        assertTrue(report.combatActiveAtEnd());
        assertEquals(1, report.finalWave());
    }

    @Test
    @DisplayName("respawn-cycle delivery leaves spawning to the framework")
    void respawnCycle() {
        var properties = new GarrisonProperties();
        properties.getSpawn().setDelivery(WaveDeliveryStrategy.RESPAWN_CYCLE);
        var report = runner(properties).run(new Scenario(2, 400, 400, 4, 1));

        assertEquals(1, report.waves().size());
        assertEquals(0, report.waves().get(0).liveGroups());
        assertEquals(1, report.notifications().size());
    }

    @Test
    @DisplayName("invalid scenarios are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new Scenario(0, 10, 20, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Scenario(1, 30, 20, 1, 1));
    }
}
