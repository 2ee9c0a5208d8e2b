package com.example.cardclash.common;

/**
 * Queue operation refused because of the caller's current queue or match state.
 */
public class MatchmakingException extends IllegalStateException {

    public MatchmakingException(String message) {
        super(message);
    }
}
