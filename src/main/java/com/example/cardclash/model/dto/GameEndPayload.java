package com.example.cardclash.model.dto;

import com.example.cardclash.model.domain.TerminationReason;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameEndPayload {
    private String winnerId; // null for a draw or an aborted match
    private TerminationReason reason;
}
