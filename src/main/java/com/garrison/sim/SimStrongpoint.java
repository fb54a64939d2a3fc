package com.garrison.sim;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;
import com.garrison.core.world.Strongpoint;

public class SimStrongpoint implements Strongpoint {

    private final String id;
    private final String name;
    private final Position position;
    private Faction faction;

    public SimStrongpoint(String id, String name, Faction faction, Position position) {
        this.id = id;
        this.name = name;
        this.faction = faction;
        this.position = position;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Faction faction() {
        return faction;
    }

    public void capture(Faction newFaction) {
        this.faction = newFaction;
    }

    @Override
    public Position position() {
        return position;
    }
}
