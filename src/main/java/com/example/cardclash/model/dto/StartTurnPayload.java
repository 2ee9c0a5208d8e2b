package com.example.cardclash.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartTurnPayload {
    private String currentPlayerId;
    private long timeAllowedSeconds;
    private int turnNumber;
}
