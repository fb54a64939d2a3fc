package com.garrison.sim;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;
import com.garrison.core.model.SpawnPointId;
import com.garrison.core.spawnpoint.DefenderSpawnPoint;
import com.garrison.core.spawnpoint.GarrisonRuntimeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Plays a {@link Scenario} against an in-memory world: defenders register in
 * reverse id order, the election settles, one attacker then sits on the
 * strongpoint for the attack duration.
 */
public class ScenarioRunner {

    private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration WARMUP = Duration.ofSeconds(30);

    private final GarrisonRuntimeFactory factory;

    public ScenarioRunner(GarrisonRuntimeFactory factory) {
        this.factory = factory;
    }

    public ScenarioReport run(Scenario scenario) {
        var scheduler = new ManualTickScheduler(START);
        var world = new SimWorld(scheduler::now);
        var sink = new RecordingNotificationSink();
        world.setPlayerCount(scenario.players());

        var defenders = new Faction("OPFOR");
        var attackers = new Faction("BLUFOR");
        var outpost = world.addStrongpoint(new SimStrongpoint("SP-KILO", "Outpost Kilo", defenders, new Position(0, 0, 0)));
        world.addStrongpoint(new SimStrongpoint("SP-LIMA", "Firebase Lima", attackers, new Position(1500, 0, 0)));

        var runtime = factory.create(world, scheduler, sink, new Random(scenario.seed()));
        var frameworks = new ArrayList<SimSpawnPointFramework>();
        var spawnPoints = new ArrayList<DefenderSpawnPoint>();
        for (int i = scenario.spawnPoints(); i >= 1; i--) {
            var framework = new SimSpawnPointFramework();
            var sp = runtime.createDefender(new SpawnPointId(1000L + i), defenders, framework);
            sp.prepare(outpost);
            frameworks.add(framework);
            spawnPoints.add(sp);
        }

        scheduler.advanceBy(WARMUP);
        var coordinator = spawnPoints.stream().filter(DefenderSpawnPoint::isCoordinator).findFirst()
                .orElseThrow(() -> new IllegalStateException("No coordinator elected"));
        log.info("Scenario coordinator: {}", coordinator.id());

        var attacker = world.addActor(new SimActor(attackers, new Position(60, 0, 40)));
        var waves = new ArrayList<ScenarioReport.WaveEvent>();
        int lastWave = 0;
        for (long second = 1; second <= scenario.totalSeconds(); second++) {
            if (second == scenario.attackSeconds() + 1L) {
                world.removeActor(attacker);
            }
            scheduler.advanceBy(Duration.ofSeconds(1));
            runExpiredCycles(frameworks, spawnPoints);

            int wave = coordinator.combatState().map(s -> s.currentWave()).orElse(0);
            if (wave > lastWave) {
                waves.add(new ScenarioReport.WaveEvent(second, wave, world.liveGroups().size()));
            }
            lastWave = wave;
        }

        var state = coordinator.combatState().orElseThrow();
        return new ScenarioReport(coordinator.id(), List.copyOf(waves), sink.sent(),
                state.isActive(), state.currentWave());
    }

    private static void runExpiredCycles(List<SimSpawnPointFramework> frameworks, List<DefenderSpawnPoint> spawnPoints) {
        for (int i = 0; i < frameworks.size(); i++) {
            var framework = frameworks.get(i);
            if (framework.isRespawnTimerExpired()) {
                framework.runCycle(spawnPoints.get(i));
            }
        }
    }
}
