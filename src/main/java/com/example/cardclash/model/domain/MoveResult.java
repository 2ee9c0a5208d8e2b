package com.example.cardclash.model.domain;

import java.util.List;

public record MoveResult(GameState state, List<GameEvent> events) {

    public MoveResult {
        events = List.copyOf(events);
    }
}
