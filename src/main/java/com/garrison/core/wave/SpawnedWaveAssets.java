package com.garrison.core.wave;

import com.garrison.core.world.EntityHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Entities created by the most recent wave at one strongpoint, in spawn order.
 * Owned by the coordinator; not shared.
 */
public class SpawnedWaveAssets {

    private static final Logger log = LoggerFactory.getLogger(SpawnedWaveAssets.class);

    private final List<EntityHandle> handles = new ArrayList<>();

    public void track(EntityHandle handle) {
        handles.add(handle);
    }

    public List<EntityHandle> handles() {
        return List.copyOf(handles);
    }

    public int size() {
        return handles.size();
    }

    public boolean isEmpty() {
        return handles.isEmpty();
    }

    /**
     * Drops handles whose entity was destroyed or removed externally.
     *
     * @return number of handles dropped
     */
    public int pruneInvalid() {
        int removed = 0;
        Iterator<EntityHandle> it = handles.iterator();
        while (it.hasNext()) {
            if (!it.next().isValid()) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Pruned {} stale wave handles", removed);
        }
        return removed;
    }

    /**
     * Despawns every tracked entity that still exists and empties the collection.
     * Safe to call repeatedly.
     *
     * @return number of entities actually despawned
     */
    public int despawnAll() {
        var toRemove = new ArrayList<>(handles);
        handles.clear();

        int despawned = 0;
        for (EntityHandle handle : toRemove) {
            if (!handle.isValid()) continue;
            try {
                handle.despawn();
                despawned++;
            } catch (RuntimeException e) {
                log.debug("Entity {} vanished during despawn: {}", handle.id(), e.getMessage());
            }
        }
        if (!toRemove.isEmpty()) {
            log.info("Despawned {}/{} previous wave entities", despawned, toRemove.size());
        }
        return despawned;
    }
}
