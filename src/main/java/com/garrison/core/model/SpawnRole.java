package com.garrison.core.model;

public enum SpawnRole {
    DEFENDER,
    ATTACKER
}
