package com.example.cardclash.model.domain;

public enum EventType {
    CARD_PLACED,
    CARD_FLIPPED,
    CARD_DRAWN,
    ABILITY_TRIGGERED,
    POWER_CHANGED,
    TILE_EFFECT_APPLIED,
    TILE_RESET,
    TURN_ENDED,
    GAME_OVER
}
