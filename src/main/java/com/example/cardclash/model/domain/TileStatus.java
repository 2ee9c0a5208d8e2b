package com.example.cardclash.model.domain;

public enum TileStatus {
    CURSED,
    BLESSED,
    BLOCKED
}
