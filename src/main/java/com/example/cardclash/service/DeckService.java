package com.example.cardclash.service;

import com.example.cardclash.repository.DeckRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
public class DeckService implements DeckProvider {

    private final DeckRepository deckRepository;

    public DeckService(DeckRepository deckRepository) {
        this.deckRepository = deckRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> cardsOf(String deckRef, String userId) {
        return deckRepository.findByIdAndOwnerUserId(deckRef, userId)
                .map(deck -> new ArrayList<>(deck.getCardInstanceIds()))
                .orElseThrow(() -> new IllegalArgumentException("Unknown deck: " + deckRef));
    }
}
