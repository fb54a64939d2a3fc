package com.garrison.core.wave;

import com.garrison.core.model.SkillTier;
import com.garrison.core.world.AiAgent;
import com.garrison.core.world.SpawnedGroup;
import com.garrison.core.world.WorldQueryFacade;

/**
 * Applies player-count based skill and perception to freshly spawned agents.
 */
public class AgentTuner {

    private final WorldQueryFacade world;
    private final int mediumPlayers;
    private final int largePlayers;

    public AgentTuner(WorldQueryFacade world, int mediumPlayers, int largePlayers) {
        this.world = world;
        this.mediumPlayers = mediumPlayers;
        this.largePlayers = largePlayers;
    }

    public SkillTier currentTier() {
        return SkillTier.forPlayerCount(world.playerCount(), mediumPlayers, largePlayers);
    }

    public SkillTier tune(SpawnedGroup group) {
        SkillTier tier = currentTier();
        for (AiAgent agent : group.agents()) {
            if (agent == null) continue;
            agent.setSkill(tier.skill());
            agent.setPerceptionFactor(tier.perception());
        }
        return tier;
    }
}
