package com.example.cardclash.common;

/**
 * A player action that the rules reject. The state it was applied to is left unchanged.
 */
public class IllegalMoveException extends IllegalStateException {

    public IllegalMoveException(String message) {
        super(message);
    }
}
