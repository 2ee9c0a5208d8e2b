package com.example.cardclash.logic.ability;

import com.example.cardclash.model.domain.AbilityEffect;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.GameEvent;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.InGameCard;
import com.example.cardclash.model.domain.TriggerMoment;

import java.util.List;

/**
 * Everything a handler gets to see when one card's ability fires.
 *
 * @param state           a private copy the handler may modify and return
 * @param position        cell of the card whose ability fired
 * @param ownerId         owner of that cell when the ability fired; effects act on its behalf
 * @param actingPlayerId  player whose action caused the trigger
 * @param relatedPosition the other cell of a flip (flipped cell for OnFlip, flipper for OnFlipped), else null
 * @param events          sink for the events the handler produces
 */
public record AbilityInvocation(GameState state,
                                BoardPosition position,
                                String ownerId,
                                String actingPlayerId,
                                TriggerMoment moment,
                                InGameCard card,
                                AbilityEffect effect,
                                BoardPosition relatedPosition,
                                List<GameEvent> events) {
}
