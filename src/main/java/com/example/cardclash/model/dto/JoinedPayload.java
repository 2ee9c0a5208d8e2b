package com.example.cardclash.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinedPayload {
    private GameStateView gameState;
    private int playerSlot; // 1 or 2
}
