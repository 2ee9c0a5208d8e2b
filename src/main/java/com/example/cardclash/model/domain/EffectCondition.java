package com.example.cardclash.model.domain;

public enum EffectCondition {
    ALWAYS,
    ADJACENT_ENEMY_PRESENT,
    OWNER_TRAILING,
    OPPONENT_WIPED_OUT
}
