package com.garrison.core.escalation;

import com.garrison.core.config.GarrisonProperties;
import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.model.WaveSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WaveTableTest {

    private static final List<UnitGroupSpec> TEAM = List.of(UnitGroupSpec.ground("Group_FireTeam", 4));

    private static WaveSpec wave(int number, int threshold) {
        return new WaveSpec(number, TEAM, null, 100, 300, threshold);
    }

    @Test
    @DisplayName("default table has four waves at five minute steps")
    void defaults() {
        var table = WaveTable.of(new GarrisonProperties().waveSpecs());
        assertEquals(4, table.maxWave());
        assertEquals(List.of(300, 600, 900, 1200),
                table.ascending().stream().map(WaveSpec::thresholdSeconds).toList());
        assertEquals(4, table.highestFirst().get(0).waveNumber());
        assertTrue(table.find(4).orElseThrow().aerial().isPresent());
    }

    @Test
    @DisplayName("waves are sorted by number regardless of input order")
    void sorts() {
        var table = WaveTable.of(List.of(wave(2, 600), wave(1, 300)));
        assertEquals(1, table.ascending().get(0).waveNumber());
        assertEquals(2, table.highestFirst().get(0).waveNumber());
        assertTrue(table.find(3).isEmpty());
    }

    @Test
    @DisplayName("empty table is rejected")
    void empty() {
        assertThrows(WaveConfigurationException.class, () -> WaveTable.of(List.of()));
        assertThrows(WaveConfigurationException.class, () -> WaveTable.of(null));
    }

    @Test
    @DisplayName("thresholds must strictly increase with wave number")
    void monotonicThresholds() {
        var ex = assertThrows(WaveConfigurationException.class,
                () -> WaveTable.of(List.of(wave(1, 600), wave(2, 600))));
        assertTrue(ex.getMessage().contains("Wave 2"));
        assertThrows(WaveConfigurationException.class,
                () -> WaveTable.of(List.of(wave(1, 600), wave(2, 300))));
    }

    @Test
    @DisplayName("duplicate and non-positive wave numbers are rejected")
    void numbers() {
        assertThrows(WaveConfigurationException.class, () -> WaveTable.of(List.of(wave(1, 300), wave(1, 600))));
        assertThrows(WaveConfigurationException.class, () -> WaveTable.of(List.of(wave(0, 300))));
    }

    @Test
    @DisplayName("invalid radius range, empty groups and bad group specs are rejected")
    void groupValidation() {
        assertThrows(WaveConfigurationException.class,
                () -> WaveTable.of(List.of(new WaveSpec(1, TEAM, null, 300, 100, 300))));
        assertThrows(WaveConfigurationException.class,
                () -> WaveTable.of(List.of(new WaveSpec(1, List.of(), null, 100, 300, 300))));
        assertThrows(WaveConfigurationException.class,
                () -> WaveTable.of(List.of(new WaveSpec(1, List.of(UnitGroupSpec.ground(" ", 4)), null, 100, 300, 300))));
        assertThrows(WaveConfigurationException.class,
                () -> WaveTable.of(List.of(new WaveSpec(1, List.of(UnitGroupSpec.ground("Group_FireTeam", 0)), null, 100, 300, 300))));
        assertThrows(WaveConfigurationException.class,
                () -> WaveTable.of(List.of(new WaveSpec(1, TEAM, null, 100, 300, -1))));
    }

    @Test
    @DisplayName("an aerial-only wave is valid")
    void aerialOnly() {
        var table = WaveTable.of(List.of(
                new WaveSpec(1, List.of(), UnitGroupSpec.air("Helicopter_Transport", 2), 200, 400, 60)));
        assertEquals(1, table.maxWave());
    }
}
