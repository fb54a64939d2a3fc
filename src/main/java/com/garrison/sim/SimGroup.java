package com.garrison.sim;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;
import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.world.AiAgent;
import com.garrison.core.world.SpawnedGroup;
import com.garrison.core.world.Strongpoint;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory unit group. Starts with a patrol directive, as prefab groups often do.
 */
public class SimGroup implements SpawnedGroup {

    private final String id;
    private final UnitGroupSpec spec;
    private final Faction faction;
    private final Position position;
    private final List<AiAgent> agents = new ArrayList<>();
    private final List<String> directives = new ArrayList<>(List.of("patrol"));
    private Strongpoint defendTarget;
    private boolean valid = true;
    private int despawnCount;

    public SimGroup(String id, UnitGroupSpec spec, Faction faction, Position position) {
        this.id = id;
        this.spec = spec;
        this.faction = faction;
        this.position = position;
    }

    @Override
    public String id() {
        return id;
    }

    public UnitGroupSpec spec() {
        return spec;
    }

    public Faction faction() {
        return faction;
    }

    public Position position() {
        return position;
    }

    @Override
    public boolean isValid() {
        return valid;
    }

    /** Simulates destruction in combat. */
    public void destroy() {
        valid = false;
    }

    @Override
    public void despawn() {
        if (valid) {
            despawnCount++;
        }
        valid = false;
    }

    public int despawnCount() {
        return despawnCount;
    }

    @Override
    public int populate(int memberCount) {
        for (int i = 0; i < memberCount; i++) {
            agents.add(new SimAgent());
        }
        return memberCount;
    }

    @Override
    public List<AiAgent> agents() {
        return agents;
    }

    @Override
    public void assignDefendDirective(Strongpoint target) {
        directives.clear();
        directives.add("defend:" + target.id());
        this.defendTarget = target;
    }

    public List<String> directives() {
        return List.copyOf(directives);
    }

    public Strongpoint defendTarget() {
        return defendTarget;
    }
}
