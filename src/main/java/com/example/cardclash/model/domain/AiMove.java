package com.example.cardclash.model.domain;

public record AiMove(String cardInstanceId, BoardPosition position, int score) {
}
