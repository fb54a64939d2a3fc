package com.garrison.core.lifecycle;

import com.garrison.core.model.Faction;
import com.garrison.core.world.Strongpoint;
import com.garrison.core.world.WorldQueryFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a strongpoint's standing defenders should keep existing.
 *
 * <p>Only strongpoints held by {@code friendlyFaction} can be thinned out. Such a
 * strongpoint is frontline while any strongpoint held by another faction lies
 * within the frontline radius; otherwise it is rear area, and after a continuous
 * grace period in the rear its defenders are released. Any check that is not a
 * rear-area observation (frontline, not friendly-held, no registry) restarts that
 * period. One guard per spawn point; the inactivity timer is not shared.
 */
public class LifecycleGuard {

    private static final Logger log = LoggerFactory.getLogger(LifecycleGuard.class);

    private final WorldQueryFacade world;
    private final Faction friendlyFaction;
    private final double frontlineRadius;
    private final Duration gracePeriod;

    private Instant rearSince;

    public LifecycleGuard(WorldQueryFacade world, Faction friendlyFaction,
                          double frontlineRadius, Duration gracePeriod) {
        this.world = world;
        this.friendlyFaction = friendlyFaction;
        this.frontlineRadius = frontlineRadius;
        this.gracePeriod = gracePeriod;
    }

    /**
     * @return {@code false} only after the strongpoint has been rear area for longer
     *         than the grace period; {@code true} whenever information is missing
     */
    public boolean shouldRemainActive(Strongpoint strongpoint) {
        if (strongpoint == null || friendlyFaction == null) {
            return true;
        }
        Faction holder = strongpoint.faction();
        if (holder == null || holder != friendlyFaction) {
            // losing the strongpoint breaks the rear-area stretch
            rearSince = null;
            return true;
        }

        var all = world.strongpoints();
        if (all.isEmpty()) {
            log.debug("Strongpoint registry unavailable, keeping {} active", strongpoint.name());
            rearSince = null;
            return true;
        }

        if (isFrontline(strongpoint, all.get())) {
            if (rearSince != null) {
                log.debug("{} is frontline again, inactivity timer cleared", strongpoint.name());
            }
            rearSince = null;
            return true;
        }

        Instant now = world.now();
        if (rearSince == null) {
            rearSince = now;
            log.debug("{} is rear area, inactivity timer started", strongpoint.name());
            return true;
        }
        if (Duration.between(rearSince, now).compareTo(gracePeriod) > 0) {
            log.info("{} has been rear area since {} - releasing standing defenders", strongpoint.name(), rearSince);
            return false;
        }
        return true;
    }

    private boolean isFrontline(Strongpoint strongpoint, Iterable<Strongpoint> all) {
        var center = strongpoint.position();
        for (Strongpoint other : all) {
            if (other == null || other == strongpoint || other.id().equals(strongpoint.id())) continue;
            Faction holder = other.faction();
            if (holder == null || holder == friendlyFaction) continue;
            if (other.position().isWithin(center, frontlineRadius)) {
                return true;
            }
        }
        return false;
    }

    /** When the current rear-area stretch began, or {@code null} while frontline. */
    public Instant rearSince() {
        return rearSince;
    }
}
