package com.garrison.core.spawnpoint;

import com.garrison.core.combat.CombatDetector;
import com.garrison.core.config.GarrisonProperties;
import com.garrison.core.election.CoordinationParticipant;
import com.garrison.core.election.CoordinatorElector;
import com.garrison.core.election.SpawnPointRegistry;
import com.garrison.core.escalation.EscalationStateMachine;
import com.garrison.core.escalation.WaveTable;
import com.garrison.core.lifecycle.LifecycleGuard;
import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.model.Faction;
import com.garrison.core.model.SpawnPointId;
import com.garrison.core.model.WaveDeliveryStrategy;
import com.garrison.core.model.WaveSpec;
import com.garrison.core.scheduler.TickScheduler;
import com.garrison.core.wave.AgentTuner;
import com.garrison.core.wave.DirectSpawnOrchestrator;
import com.garrison.core.wave.ReinforcementAlerts;
import com.garrison.core.wave.RespawnCycleOrchestrator;
import com.garrison.core.wave.SpawnPositionResolver;
import com.garrison.core.wave.WaveOrchestrator;
import com.garrison.core.world.SpawnPointFramework;
import com.garrison.core.world.Strongpoint;
import com.garrison.core.world.WorldQueryFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;

/**
 * Collaborators shared by every spawn point of one simulation, handed to each
 * spawn point at construction. Create through {@link GarrisonRuntimeFactory}.
 */
public class GarrisonRuntime {

    private static final Logger log = LoggerFactory.getLogger(GarrisonRuntime.class);

    private final WorldQueryFacade world;
    private final TickScheduler scheduler;
    private final GarrisonProperties properties;
    private final GarrisonMetrics metrics;
    private final WaveTable waves;
    private final SpawnPointRegistry registry;
    private final CoordinatorElector elector;
    private final CombatDetector detector;
    private final ReinforcementAlerts alerts;
    private final AgentTuner tuner;
    private final SpawnPositionResolver positions;
    private final SpawnCyclePlanner planner;

    GarrisonRuntime(WorldQueryFacade world, TickScheduler scheduler, GarrisonProperties properties,
                    GarrisonMetrics metrics, WaveTable waves, ReinforcementAlerts alerts,
                    SpawnPositionResolver positions) {
        this.world = world;
        this.scheduler = scheduler;
        this.properties = properties;
        this.metrics = metrics;
        this.waves = waves;
        this.registry = new SpawnPointRegistry();
        this.elector = new CoordinatorElector(registry);
        this.detector = new CombatDetector(world, properties.getDetectionRadius());
        this.alerts = alerts;
        this.tuner = new AgentTuner(world,
                properties.getSkill().getMediumPlayers(), properties.getSkill().getLargePlayers());
        this.positions = positions;
        this.planner = new SpawnCyclePlanner(properties.getSpawn());
    }

    /**
     * Creates and registers a defender spawn point. It stays passive until
     * {@link DefenderSpawnPoint#prepare(Strongpoint)} resolves its strongpoint.
     */
    public DefenderSpawnPoint createDefender(SpawnPointId id, Faction faction, SpawnPointFramework framework) {
        var spawnPoint = new DefenderSpawnPoint(id, faction, framework, this);
        registry.register(spawnPoint);
        return spawnPoint;
    }

    public AttackerSpawnPoint createAttacker(SpawnPointId id, Faction faction) {
        return new AttackerSpawnPoint(id, faction, planner, tuner);
    }

    public WaveTable waves() {
        return waves;
    }

    public SpawnPointRegistry registry() {
        return registry;
    }

    public GarrisonProperties properties() {
        return properties;
    }

    WorldQueryFacade world() {
        return world;
    }

    TickScheduler scheduler() {
        return scheduler;
    }

    GarrisonMetrics metrics() {
        return metrics;
    }

    CoordinatorElector elector() {
        return elector;
    }

    CombatDetector detector() {
        return detector;
    }

    AgentTuner tuner() {
        return tuner;
    }

    SpawnCyclePlanner planner() {
        return planner;
    }

    Duration settlingDelay() {
        return Duration.ofMillis(properties.getSettlingDelayMs());
    }

    Duration checkInterval() {
        return Duration.ofSeconds(properties.getCheckIntervalSeconds());
    }

    Duration lifecycleInterval() {
        return Duration.ofSeconds(properties.getLifecycle().getCheckIntervalSeconds());
    }

    EscalationStateMachine newStateMachine(String strongpointName) {
        return new EscalationStateMachine(strongpointName, waves,
                Duration.ofSeconds(properties.getWaveCooldownSeconds()), metrics);
    }

    LifecycleGuard newLifecycleGuard(Faction faction) {
        return new LifecycleGuard(world, faction, properties.getFrontlineRadius(),
                Duration.ofSeconds(properties.getGracePeriodSeconds()));
    }

    WaveOrchestrator newOrchestrator(SpawnPointFramework framework, Predicate<WaveSpec> reinforcementQueue) {
        if (properties.getDelivery() == WaveDeliveryStrategy.RESPAWN_CYCLE) {
            return new RespawnCycleOrchestrator(framework, reinforcementQueue, alerts);
        }
        return new DirectSpawnOrchestrator(world, positions, tuner, alerts, metrics);
    }

    /**
     * Called when a coordinator is destroyed. With failover enabled, the
     * remaining siblings of the strongpoint hold a new election.
     */
    void onCoordinatorLost(DefenderSpawnPoint lost, Strongpoint strongpoint) {
        if (!properties.isFailoverEnabled()) {
            log.warn("Coordinator {} for {} destroyed - no failover, strongpoint will not escalate",
                    lost.id(), strongpoint.name());
            return;
        }
        List<CoordinationParticipant> siblings = registry.all().stream()
                .filter(p -> p.strongpoint().map(sp -> sp.id().equals(strongpoint.id())).orElse(false))
                .toList();
        log.info("Coordinator {} for {} destroyed - re-electing among {} siblings",
                lost.id(), strongpoint.name(), siblings.size());
        siblings.forEach(CoordinationParticipant::requestElection);
    }
}
