package com.example.cardclash.model.dto;

import com.example.cardclash.model.domain.GameEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventsPayload {
    private List<GameEvent> appliedEvents;
    private GameStateView gameState;
    private boolean serverForced; // move made by the AI after a turn timeout
}
