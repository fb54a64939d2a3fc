package com.garrison.core.world;

import com.garrison.core.model.AiSkill;

public interface AiAgent {

    void setSkill(AiSkill skill);

    void setPerceptionFactor(float factor);
}
