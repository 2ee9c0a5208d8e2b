package com.example.cardclash.service;

import java.util.List;

/**
 * Source of the card-instance ids in a player's deck.
 */
public interface DeckProvider {

    /**
     * @throws IllegalArgumentException if the deck does not exist or is not owned by {@code userId}
     */
    List<String> cardsOf(String deckRef, String userId);
}
