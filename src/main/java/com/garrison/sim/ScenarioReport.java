package com.garrison.sim;

import com.garrison.core.model.SpawnPointId;

import java.util.List;

/**
 * What happened during a {@link Scenario} run.
 */
public record ScenarioReport(
    SpawnPointId coordinator,
    List<WaveEvent> waves,
    List<RecordingNotificationSink.Notification> notifications,
    boolean combatActiveAtEnd,
    int finalWave
) {

    /**
     * @param atSecond   seconds since the attack began
     * @param waveNumber wave that fired
     * @param liveGroups reinforcement groups alive right after the wave
     */
    public record WaveEvent(long atSecond, int waveNumber, int liveGroups) {}
}
