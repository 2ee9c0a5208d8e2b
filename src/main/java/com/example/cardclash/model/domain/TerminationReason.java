package com.example.cardclash.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TerminationReason {
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("surrender") SURRENDER,
    @JsonProperty("disconnect") DISCONNECT,
    @JsonProperty("aborted") ABORTED
}
