package com.example.cardclash.model.domain;

public enum CellState {
    NORMAL,
    BUFFED,
    DEBUFFED,
    IMMUNE // cannot be flipped by combat
}
