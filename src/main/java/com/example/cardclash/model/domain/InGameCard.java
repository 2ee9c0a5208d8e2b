package com.example.cardclash.model.domain;

import java.util.List;

/**
 * Battle-ready view of a card instance, resolved once per match and cached in {@link GameState}.
 *
 * @param instanceId   the opaque card-instance id used in hands, decks and on the board
 * @param cardId       id of the base card definition
 * @param basePower    printed power of the base card
 * @param currentPower base power adjusted for level and permanent enhancements
 * @param ability      may be {@code null} for vanilla cards
 */
public record InGameCard(String instanceId,
                         String cardId,
                         String ownerUserId,
                         String name,
                         String rarity,
                         int level,
                         Power basePower,
                         Power currentPower,
                         List<String> tags,
                         AbilityDescriptor ability) {

    public InGameCard {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
