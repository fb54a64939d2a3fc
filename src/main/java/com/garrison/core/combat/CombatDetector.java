package com.garrison.core.combat;

import com.garrison.core.model.Faction;
import com.garrison.core.world.Actor;
import com.garrison.core.world.Strongpoint;
import com.garrison.core.world.WorldQueryFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a strongpoint is under active hostile engagement on this tick.
 * Stateless; debouncing is the escalation state machine's job.
 */
public class CombatDetector {

    private static final Logger log = LoggerFactory.getLogger(CombatDetector.class);

    private final WorldQueryFacade world;
    private final double detectionRadius;

    public CombatDetector(WorldQueryFacade world, double detectionRadius) {
        this.world = world;
        this.detectionRadius = detectionRadius;
    }

    /**
     * A strongpoint is under attack when it is still held by {@code defendingFaction}
     * and at least one living actor of another faction is inside the detection radius.
     * Anything unresolved yields {@code false}.
     */
    public boolean detect(Strongpoint strongpoint, Faction defendingFaction) {
        if (strongpoint == null || defendingFaction == null) {
            return false;
        }
        Faction holder = strongpoint.faction();
        if (holder == null || holder != defendingFaction) {
            return false;
        }

        var actors = world.actors();
        if (actors.isEmpty()) {
            log.debug("No actor registry available, treating {} as quiet", strongpoint.name());
            return false;
        }

        var center = strongpoint.position();
        for (Actor actor : actors.get()) {
            if (actor == null || !actor.isAlive()) continue;
            Faction faction = actor.faction();
            if (faction == null || faction == defendingFaction) continue;
            if (actor.position().isWithin(center, detectionRadius)) {
                return true;
            }
        }
        return false;
    }
}
