package com.garrison.sim;

import com.garrison.core.model.Faction;
import com.garrison.core.model.Position;
import com.garrison.core.world.Actor;

public class SimActor implements Actor {

    private final Faction faction;
    private Position position;
    private boolean alive = true;

    public SimActor(Faction faction, Position position) {
        this.faction = faction;
        this.position = position;
    }

    @Override
    public Position position() {
        return position;
    }

    public void moveTo(Position position) {
        this.position = position;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    public void kill() {
        alive = false;
    }

    @Override
    public Faction faction() {
        return faction;
    }
}
