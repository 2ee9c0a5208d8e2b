package com.example.cardclash.logic;

import com.example.cardclash.common.CardNotFoundException;
import com.example.cardclash.config.CardClashProperties;
import com.example.cardclash.logic.ability.AbilityRegistry;
import com.example.cardclash.model.domain.AbilityDescriptor;
import com.example.cardclash.model.domain.BoardCell;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.InGameCard;
import com.example.cardclash.model.domain.Power;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Card fixtures shared by engine, AI and session tests.
 */
public final class TestCards {

    private TestCards() {
    }

    public static InGameCard card(String id, String owner, int top, int right, int bottom, int left) {
        return card(id, owner, new Power(top, right, bottom, left), null);
    }

    public static InGameCard card(String id, String owner, Power power, AbilityDescriptor ability) {
        return new InGameCard(id, "base-" + id, owner, "Card " + id, "common", 1, power, power, List.of(), ability);
    }

    /**
     * Puts {@code card} on the board owned by {@code ownerId}, bypassing the rules.
     */
    public static void put(GameState state, BoardPosition position, String ownerId, InGameCard card) {
        BoardCell cell = state.getBoard().cellAt(position);
        cell.place(ownerId, card);
        state.getCards().put(card.instanceId(), card);
        state.recomputeScores();
    }

    /**
     * Replaces a player's hand, caching the given cards.
     */
    public static void giveHand(GameState state, String userId, InGameCard... cards) {
        List<String> hand = new ArrayList<>();
        for (InGameCard card : cards) {
            hand.add(card.instanceId());
            state.getCards().put(card.instanceId(), card);
        }
        state.player(userId).setHand(hand);
    }

    public static GameEngine engine(CardInstanceHydrator hydrator) {
        return engine(hydrator, new AbilityRegistry());
    }

    public static GameEngine engine(CardInstanceHydrator hydrator, AbilityRegistry registry) {
        return new GameEngine(hydrator, registry, new CardClashProperties(), new Random(42));
    }

    public static class MapHydrator implements CardInstanceHydrator {
        private final Map<String, InGameCard> cards = new HashMap<>();

        public MapHydrator add(InGameCard card) {
            cards.put(card.instanceId(), card);
            return this;
        }

        /**
         * Registers {@code count} plain cards {@code prefix1..prefixN} owned by {@code owner}.
         */
        public List<String> addDeck(String prefix, String owner, int count, int power) {
            List<String> ids = new ArrayList<>();
            for (int i = 1; i <= count; i++) {
                String id = prefix + i;
                add(card(id, owner, power, power, power, power));
                ids.add(id);
            }
            return ids;
        }

        @Override
        public InGameCard resolve(String cardInstanceId, String ownerUserId) {
            InGameCard card = cards.get(cardInstanceId);
            if (card == null || (ownerUserId != null && !ownerUserId.equals(card.ownerUserId()))) {
                throw new CardNotFoundException(cardInstanceId);
            }
            return card;
        }
    }
}
