package com.example.cardclash.service;

public enum SessionPhase {
    AWAITING_PLAYERS,
    ACTIVE,
    COMPLETED,
    ABORTED
}
