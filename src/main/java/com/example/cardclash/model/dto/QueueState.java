package com.example.cardclash.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QueueState {
    @JsonProperty("idle") IDLE,
    @JsonProperty("queued") QUEUED,
    @JsonProperty("matched") MATCHED
}
