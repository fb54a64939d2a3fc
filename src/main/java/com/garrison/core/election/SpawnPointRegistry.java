package com.garrison.core.election;

import com.garrison.core.model.SpawnPointId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Every live spawn point that may coordinate reinforcements, keyed by identity.
 */
public class SpawnPointRegistry {

    private static final Logger log = LoggerFactory.getLogger(SpawnPointRegistry.class);

    private final ConcurrentHashMap<SpawnPointId, CoordinationParticipant> participants = new ConcurrentHashMap<>();

    public void register(CoordinationParticipant participant) {
        participants.put(participant.id(), participant);
        log.debug("Registered spawn point {}", participant.id());
    }

    public void unregister(SpawnPointId id) {
        if (participants.remove(id) != null) {
            log.debug("Unregistered spawn point {}", id);
        }
    }

    public boolean contains(SpawnPointId id) {
        return participants.containsKey(id);
    }

    public List<CoordinationParticipant> all() {
        return List.copyOf(participants.values());
    }

    public int size() {
        return participants.size();
    }
}
