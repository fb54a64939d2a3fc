package com.garrison.core.model;

public enum AiSkill {
    ROOKIE,
    REGULAR,
    VETERAN,
    EXPERT
}
