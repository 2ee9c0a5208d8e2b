package com.example.cardclash.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of everything the server pushes on {@code /user/queue/match}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchMessage {
    private String matchId;
    private MessageType type;
    private Object payload;
}
