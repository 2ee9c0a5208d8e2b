package com.example.cardclash.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchmakingStatus {
    private QueueState status;
    private String matchId;

    public static MatchmakingStatus idle() {
        return new MatchmakingStatus(QueueState.IDLE, null);
    }

    public static MatchmakingStatus queued() {
        return new MatchmakingStatus(QueueState.QUEUED, null);
    }

    public static MatchmakingStatus matched(String matchId) {
        return new MatchmakingStatus(QueueState.MATCHED, matchId);
    }
}
