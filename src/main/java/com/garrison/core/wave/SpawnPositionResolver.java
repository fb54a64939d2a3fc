package com.garrison.core.wave;

import com.garrison.core.model.Position;
import com.garrison.core.world.WorldQueryFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Picks a terrain-safe spawn position in a ring around a strongpoint.
 */
public class SpawnPositionResolver {

    private static final Logger log = LoggerFactory.getLogger(SpawnPositionResolver.class);

    private final WorldQueryFacade world;
    private final double minSeparation;
    private final int maxAttempts;
    private final Random random;

    public SpawnPositionResolver(WorldQueryFacade world, double minSeparation, int maxAttempts, Random random) {
        this.world = world;
        this.minSeparation = minSeparation;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    /**
     * A random valid candidate within {@code [minRadius, maxRadius]} of {@code center},
     * or {@code center} itself when the terrain search finds nothing.
     */
    public Position resolve(Position center, double minRadius, double maxRadius) {
        var candidates = world.findEmptyPositions(center, minRadius, maxRadius, minSeparation, maxAttempts);
        if (candidates == null || candidates.isEmpty()) {
            log.debug("No empty terrain within [{}, {}]m, using strongpoint origin", minRadius, maxRadius);
            return center;
        }
        return candidates.get(random.nextInt(candidates.size()));
    }
}
