package com.garrison.core.model;

/**
 * Coarse AI tuning tier chosen from the connected player count.
 * Small and medium sessions share the baseline; only large sessions are elevated.
 */
public enum SkillTier {
    SMALL(AiSkill.VETERAN, 1.0f),
    MEDIUM(AiSkill.VETERAN, 1.0f),
    LARGE(AiSkill.EXPERT, 1.5f);

    private final AiSkill skill;
    private final float perception;

    SkillTier(AiSkill skill, float perception) {
        this.skill = skill;
        this.perception = perception;
    }

    public AiSkill skill() {
        return skill;
    }

    public float perception() {
        return perception;
    }

    /**
     * @param playerCount     connected players
     * @param mediumThreshold first player count of the medium tier (5)
     * @param largeThreshold  first player count of the large tier (10)
     */
    public static SkillTier forPlayerCount(int playerCount, int mediumThreshold, int largeThreshold) {
        if (playerCount >= largeThreshold) return LARGE;
        if (playerCount >= mediumThreshold) return MEDIUM;
        return SMALL;
    }
}
