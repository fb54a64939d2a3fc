package com.garrison.core.spawnpoint;

import com.garrison.core.election.CoordinationParticipant;
import com.garrison.core.escalation.CombatState;
import com.garrison.core.escalation.EscalationStateMachine;
import com.garrison.core.lifecycle.LifecycleGuard;
import com.garrison.core.logging.MdcContext;
import com.garrison.core.model.Faction;
import com.garrison.core.model.SpawnMode;
import com.garrison.core.model.SpawnParameters;
import com.garrison.core.model.SpawnPointId;
import com.garrison.core.model.SpawnRole;
import com.garrison.core.model.WaveSpec;
import com.garrison.core.scheduler.ScheduledTick;
import com.garrison.core.wave.SpawnedWaveAssets;
import com.garrison.core.wave.WaveOrchestrator;
import com.garrison.core.wave.WaveSpawnResult;
import com.garrison.core.world.SpawnCycleParameters;
import com.garrison.core.world.SpawnPointFramework;
import com.garrison.core.world.SpawnedGroup;
import com.garrison.core.world.Strongpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * A spawn point maintaining standing defenders at one strongpoint.
 *
 * <p>Several defender spawn points may guard the same strongpoint. Once the
 * strongpoint is resolved each one schedules a single election after a settling
 * delay; the winner owns the escalation timeline ({@link CombatState} and the
 * spawned wave assets) and is the only one that schedules the escalation tick.
 * Every spawn point, coordinator or not, runs its own lifecycle check.
 */
public class DefenderSpawnPoint implements CoordinationParticipant, SpawnCycleParameters {

    private static final Logger log = LoggerFactory.getLogger(DefenderSpawnPoint.class);

    private final SpawnPointId id;
    private final Faction faction;
    private final SpawnPointFramework framework;
    private final GarrisonRuntime runtime;
    private final LifecycleGuard lifecycleGuard;

    private Strongpoint strongpoint;
    private boolean coordinatorInitialized;
    private boolean coordinator;
    private boolean destroyed;
    private boolean standingDown;
    private SpawnMode mode = SpawnMode.NORMAL;

    private EscalationStateMachine escalation;
    private SpawnedWaveAssets waveAssets;
    private WaveOrchestrator orchestrator;

    private ScheduledTick electionTick;
    private ScheduledTick escalationTick;
    private ScheduledTick updateTick;

    DefenderSpawnPoint(SpawnPointId id, Faction faction, SpawnPointFramework framework, GarrisonRuntime runtime) {
        this.id = id;
        this.faction = faction;
        this.framework = framework;
        this.runtime = runtime;
        this.lifecycleGuard = runtime.newLifecycleGuard(faction);
        var params = runtime.planner().plan(SpawnRole.DEFENDER, SpawnMode.NORMAL, false);
        log.info("Defender spawn point {} ({}) initialized - respawn {}s, groups {}",
                id, faction, params.respawnSeconds(), params.groupCount());
    }

    @Override
    public SpawnPointId id() {
        return id;
    }

    public Faction faction() {
        return faction;
    }

    @Override
    public Optional<Strongpoint> strongpoint() {
        return Optional.ofNullable(strongpoint);
    }

    public boolean isCoordinator() {
        return coordinator;
    }

    public boolean isCoordinatorInitialized() {
        return coordinatorInitialized;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean isStandingDown() {
        return standingDown;
    }

    public SpawnMode mode() {
        return mode;
    }

    /** Escalation state, present only while this spawn point coordinates. */
    public Optional<CombatState> combatState() {
        return escalation == null ? Optional.empty() : Optional.of(escalation.state());
    }

    public Optional<SpawnedWaveAssets> waveAssets() {
        return Optional.ofNullable(waveAssets);
    }

    /**
     * Binds the strongpoint this spawn point guards. The first successful call
     * schedules coordinator election and the lifecycle check; later calls only
     * refresh the reference.
     */
    public void prepare(Strongpoint resolved) {
        if (destroyed || resolved == null) {
            return;
        }
        this.strongpoint = resolved;
        if (coordinatorInitialized) {
            return;
        }
        coordinatorInitialized = true;
        electionTick = runtime.scheduler().schedule("coordinator-election", runtime.settlingDelay(), this::runElection);
        updateTick = runtime.scheduler().scheduleAtFixedRate("spawnpoint-update", runtime.lifecycleInterval(), this::onUpdate);
        log.info("Scheduled coordinator election for {} at {}", id, resolved.name());
    }

    @Override
    public void requestElection() {
        if (destroyed || coordinator || strongpoint == null) {
            return;
        }
        if (electionTick != null) {
            electionTick.cancel();
        }
        electionTick = runtime.scheduler().schedule("coordinator-election", runtime.settlingDelay(), this::runElection);
    }

    void runElection() {
        if (destroyed || strongpoint == null || coordinator) {
            return;
        }
        coordinator = runtime.elector().isCoordinator(this);
        if (runtime.metrics() != null) {
            runtime.metrics().recordElection(coordinator);
        }
        if (!coordinator) {
            log.info("Spawn point {} is NON-COORDINATOR for {} (no periodic checks)", id, strongpoint.name());
            return;
        }

        escalation = runtime.newStateMachine(strongpoint.name());
        waveAssets = new SpawnedWaveAssets();
        orchestrator = runtime.newOrchestrator(framework, this::queueReinforcement);
        escalationTick = runtime.scheduler().scheduleAtFixedRate("escalation-check", runtime.checkInterval(), this::tick);
        log.info("Spawn point {} is COORDINATOR for {}", id, strongpoint.name());
    }

    /**
     * One escalation step: sweep stale wave handles, sample combat, advance the
     * state machine and spawn the wave it picks.
     */
    void tick() {
        if (destroyed || !coordinator || strongpoint == null) {
            return;
        }
        MdcContext.setSpawnPoint(strongpoint.name(), id.toString());
        try {
            waveAssets.pruneInvalid();

            boolean combatActive = runtime.detector().detect(strongpoint, faction);
            log.debug("Combat check at {}: {}", strongpoint.name(), combatActive);

            boolean wasActive = escalation.state().isActive();
            var fired = escalation.evaluate(combatActive, runtime.world().now());
            if (wasActive && !escalation.state().isActive()) {
                mode = SpawnMode.NORMAL;
            }
            fired.ifPresent(this::deliver);
        } finally {
            MdcContext.clear();
        }
    }

    private void deliver(WaveSpec wave) {
        MdcContext.setWave(wave.waveNumber());
        WaveSpawnResult result = orchestrator.trigger(strongpoint, faction, wave, waveAssets);
        log.debug("Wave {} result: {}/{} groups{}", wave.waveNumber(), result.spawnedGroups(),
                result.requestedGroups(), result.deferred() ? " (deferred to spawn cycle)" : "");
    }

    /**
     * @return {@code false} while standing down, since no cycle would produce the wave
     */
    private boolean queueReinforcement(WaveSpec wave) {
        if (standingDown) {
            return false;
        }
        mode = new SpawnMode.Reinforcement(wave);
        return true;
    }

    /**
     * Per-spawn-point update: applies the lifecycle guard. Not gated by coordinator status.
     *
     * @return whether standing defenders should exist
     */
    public boolean onUpdate() {
        if (destroyed || strongpoint == null) {
            return true;
        }
        boolean remain = lifecycleGuard.shouldRemainActive(strongpoint);
        if (!remain && !standingDown) {
            standingDown = true;
            if (framework.hasActiveGroup()) {
                framework.despawnActiveGroup();
            }
            if (runtime.metrics() != null) {
                runtime.metrics().recordTeardown();
            }
            log.info("Spawn point {} standing down at rear-area {}", id, strongpoint.name());
        } else if (remain && standingDown) {
            standingDown = false;
            log.info("Spawn point {} resuming defence of {}", id, strongpoint.name());
        }
        return remain;
    }

    /**
     * Parameters for the base framework's next cycle. A queued reinforcement is
     * consumed by exactly one cycle.
     */
    @Override
    public SpawnParameters nextCycle() {
        SpawnParameters params = runtime.planner().plan(SpawnRole.DEFENDER, mode, standingDown);
        if (mode instanceof SpawnMode.Reinforcement && !standingDown) {
            mode = SpawnMode.NORMAL;
        }
        return params;
    }

    /**
     * Hook for the base framework after it spawned this point's standing group.
     */
    public void onStandingGroupSpawned(SpawnedGroup group) {
        runtime.tuner().tune(group);
    }

    /**
     * Tears the spawn point down: cancels its timers, leaves the registry and,
     * when it was coordinating, hands the strongpoint to failover.
     */
    public void destroy() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        cancel(electionTick);
        cancel(updateTick);
        cancel(escalationTick);
        runtime.registry().unregister(id);

        if (coordinator) {
            log.info("Cleaned up coordinator callbacks for {}", id);
            coordinator = false;
            escalation = null;
            waveAssets = null;
            if (strongpoint != null) {
                runtime.onCoordinatorLost(this, strongpoint);
            }
        }
    }

    private static void cancel(ScheduledTick tick) {
        if (tick != null) {
            tick.cancel();
        }
    }
}
