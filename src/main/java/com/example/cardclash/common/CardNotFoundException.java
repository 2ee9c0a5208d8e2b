package com.example.cardclash.common;

public class CardNotFoundException extends RuntimeException {

    public CardNotFoundException(String cardInstanceId) {
        super("Card instance not found: " + cardInstanceId);
    }
}
