package com.example.cardclash.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ActionType {
    @JsonProperty("placeCard") PLACE_CARD,
    @JsonProperty("endTurn") END_TURN,
    @JsonProperty("surrender") SURRENDER
}
