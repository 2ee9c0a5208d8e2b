package com.example.cardclash.model.dto;

import com.example.cardclash.model.domain.BoardPosition;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionRequest {
    private String matchId; // optional, the destination already names the match
    private ActionType actionType;
    private String cardInstanceId; // placeCard only
    private BoardPosition position; // placeCard only
}
