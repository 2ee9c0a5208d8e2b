package com.example.cardclash.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageType {
    @JsonProperty("joined") JOINED,
    @JsonProperty("player_joined") PLAYER_JOINED,
    @JsonProperty("start_turn") START_TURN,
    @JsonProperty("events") EVENTS,
    @JsonProperty("game_end") GAME_END,
    @JsonProperty("session_replaced") SESSION_REPLACED
}
