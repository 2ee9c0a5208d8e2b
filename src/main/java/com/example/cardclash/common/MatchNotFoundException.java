package com.example.cardclash.common;

public class MatchNotFoundException extends RuntimeException {

    public MatchNotFoundException(String matchId) {
        super("Match not found: " + matchId);
    }
}
