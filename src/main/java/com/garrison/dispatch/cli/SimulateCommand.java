package com.garrison.dispatch.cli;

import com.garrison.core.config.GarrisonProperties;
import com.garrison.core.escalation.WaveTable;
import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.model.WaveDeliveryStrategy;
import com.garrison.core.spawnpoint.GarrisonRuntimeFactory;
import com.garrison.sim.Scenario;
import com.garrison.sim.ScenarioRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: garrison simulate
 * <p>
 * Plays a single-strongpoint assault on a virtual clock and prints the
 * escalation timeline.
 */
@Command(name = "simulate", mixinStandardHelpOptions = true, description = "Run an in-memory assault scenario")
@Component
public class SimulateCommand implements Runnable {

    @Option(names = {"--spawn-points", "-n"}, description = "Defender spawn points (default: ${DEFAULT-VALUE})",
            defaultValue = "3")
    private int spawnPoints;

    @Option(names = {"--attack-seconds", "-a"}, description = "Seconds the attacker stays on the objective (default: ${DEFAULT-VALUE})",
            defaultValue = "700")
    private int attackSeconds;

    @Option(names = {"--total-seconds", "-t"}, description = "Simulated seconds (default: ${DEFAULT-VALUE})",
            defaultValue = "800")
    private int totalSeconds;

    @Option(names = {"--players", "-p"}, description = "Connected players (default: ${DEFAULT-VALUE})",
            defaultValue = "4")
    private int players;

    @Option(names = {"--delivery"}, description = "DIRECT_SPAWN or RESPAWN_CYCLE (default: configured)")
    private WaveDeliveryStrategy delivery;

    @Option(names = {"--seed"}, description = "Random seed (default: ${DEFAULT-VALUE})", defaultValue = "42")
    private long seed;

    private final GarrisonProperties properties;
    private final WaveTable waveTable;
    private final GarrisonMetrics metrics;

    public SimulateCommand(GarrisonProperties properties, WaveTable waveTable, GarrisonMetrics metrics) {
        this.properties = properties;
        this.waveTable = waveTable;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Scenario scenario;
        try {
            scenario = new Scenario(spawnPoints, attackSeconds, totalSeconds, players, seed);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        if (delivery != null) {
            properties.getSpawn().setDelivery(delivery);
        }
        var runner = new ScenarioRunner(new GarrisonRuntimeFactory(properties, waveTable, metrics));
        var report = runner.run(scenario);

        ConsoleOutput.info(String.format("Coordinator: %s (of %d spawn points), delivery %s",
                report.coordinator(), spawnPoints, properties.getDelivery()));
        ConsoleOutput.info("Attack held for " + ConsoleOutput.formatDuration(attackSeconds)
                + " of " + ConsoleOutput.formatDuration(totalSeconds));

        if (report.waves().isEmpty()) {
            ConsoleOutput.info("No reinforcement waves fired");
        }
        report.waves().forEach(w -> ConsoleOutput.waveFired(w.atSecond(), w.waveNumber(), w.liveGroups()));
        report.notifications().forEach(n -> ConsoleOutput.notification(n.title(), n.subtitle()));

        System.out.println("──────────────────────────────────");
        if (report.combatActiveAtEnd()) {
            ConsoleOutput.success("Combat ongoing at wave " + report.finalWave());
        } else {
            ConsoleOutput.success("Combat ended, escalation reset");
        }
    }
}
