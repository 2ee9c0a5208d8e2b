package com.example.cardclash.common;

public class GamePersistenceException extends RuntimeException {

    public GamePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
