package com.example.cardclash.model.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class PlayerState {
    private String userId;
    private List<String> hand = new ArrayList<>();
    private List<String> deck = new ArrayList<>(); // next draw is index 0
    private int score;

    public PlayerState(String userId, List<String> hand, List<String> deck) {
        this.userId = userId;
        this.hand = new ArrayList<>(hand);
        this.deck = new ArrayList<>(deck);
    }

    public PlayerState copy() {
        PlayerState copy = new PlayerState(userId, hand, deck);
        copy.score = score;
        return copy;
    }
}
