package com.garrison.sim;

import com.garrison.core.model.AiSkill;
import com.garrison.core.world.AiAgent;

public class SimAgent implements AiAgent {

    private AiSkill skill = AiSkill.REGULAR;
    private float perception = 1.5f;

    @Override
    public void setSkill(AiSkill skill) {
        this.skill = skill;
    }

    @Override
    public void setPerceptionFactor(float factor) {
        this.perception = factor;
    }

    public AiSkill skill() {
        return skill;
    }

    public float perception() {
        return perception;
    }
}
