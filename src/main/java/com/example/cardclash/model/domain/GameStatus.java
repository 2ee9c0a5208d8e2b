package com.example.cardclash.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum GameStatus {
    @JsonProperty("active") ACTIVE,
    @JsonProperty("player1_win") PLAYER1_WIN,
    @JsonProperty("player2_win") PLAYER2_WIN,
    @JsonProperty("draw") DRAW,
    @JsonProperty("aborted") ABORTED
}
