package com.garrison.core.escalation;

import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.model.WaveSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Validated, ordered set of escalation waves. Higher wave numbers always
 * carry strictly higher thresholds.
 */
public final class WaveTable {

    private final List<WaveSpec> ascending;
    private final List<WaveSpec> descending;

    private WaveTable(List<WaveSpec> ascending) {
        this.ascending = List.copyOf(ascending);
        var reversed = new ArrayList<>(ascending);
        Collections.reverse(reversed);
        this.descending = List.copyOf(reversed);
    }

    /**
     * @throws WaveConfigurationException when the waves are empty or inconsistent
     */
    public static WaveTable of(List<WaveSpec> waves) {
        if (waves == null || waves.isEmpty()) {
            throw new WaveConfigurationException("At least one wave must be configured");
        }
        var sorted = new ArrayList<>(waves);
        sorted.sort(Comparator.comparingInt(WaveSpec::waveNumber));

        WaveSpec previous = null;
        for (WaveSpec wave : sorted) {
            validate(wave);
            if (previous != null) {
                if (previous.waveNumber() == wave.waveNumber()) {
                    throw new WaveConfigurationException("Duplicate wave number " + wave.waveNumber());
                }
                if (previous.thresholdSeconds() >= wave.thresholdSeconds()) {
                    throw new WaveConfigurationException(String.format(
                            "Wave %d threshold %ds must exceed wave %d threshold %ds",
                            wave.waveNumber(), wave.thresholdSeconds(),
                            previous.waveNumber(), previous.thresholdSeconds()));
                }
            }
            previous = wave;
        }
        return new WaveTable(sorted);
    }

    private static void validate(WaveSpec wave) {
        int n = wave.waveNumber();
        if (n < 1) {
            throw new WaveConfigurationException("Wave numbers start at 1, got " + n);
        }
        if (wave.thresholdSeconds() < 0) {
            throw new WaveConfigurationException("Wave " + n + " has a negative threshold");
        }
        if (wave.minSpawnRadius() < 0 || wave.minSpawnRadius() > wave.maxSpawnRadius()) {
            throw new WaveConfigurationException(String.format(
                    "Wave %d spawn radius range [%.1f, %.1f] is invalid",
                    n, wave.minSpawnRadius(), wave.maxSpawnRadius()));
        }
        if (wave.allGroups().isEmpty()) {
            throw new WaveConfigurationException("Wave " + n + " spawns nothing");
        }
        for (UnitGroupSpec group : wave.allGroups()) {
            if (group.prefab() == null || group.prefab().isBlank()) {
                throw new WaveConfigurationException("Wave " + n + " has a group without a prefab");
            }
            if (group.memberCount() <= 0) {
                throw new WaveConfigurationException("Wave " + n + " group " + group.prefab()
                        + " needs at least one member");
            }
        }
    }

    public List<WaveSpec> ascending() {
        return ascending;
    }

    public List<WaveSpec> highestFirst() {
        return descending;
    }

    public int maxWave() {
        return ascending.get(ascending.size() - 1).waveNumber();
    }

    public Optional<WaveSpec> find(int waveNumber) {
        return ascending.stream().filter(w -> w.waveNumber() == waveNumber).findFirst();
    }
}
