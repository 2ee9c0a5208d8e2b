package com.example.cardclash.logic.ability;

import com.example.cardclash.model.domain.AbilityDescriptor;
import com.example.cardclash.model.domain.AbilityEffect;
import com.example.cardclash.model.domain.BoardCell;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.EffectKind;
import com.example.cardclash.model.domain.EventType;
import com.example.cardclash.model.domain.GameEvent;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.InGameCard;
import com.example.cardclash.model.domain.TriggerMoment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs card abilities at trigger moments.
 * <p>
 * For one {@link #fire} call the subject cells are visited in board-scan order (top-left to
 * bottom-right, row by row). Each matching ability gets a copy of the state as left by the
 * previous one, so later abilities see earlier results. A handler that throws is logged and its
 * changes discarded. Firing stops as soon as an ability ends the match.
 */
@Slf4j
@Component
public class AbilityRegistry {

    private final Map<EffectKind, AbilityHandler> handlers = new EnumMap<>(EffectKind.class);

    public AbilityRegistry() {
        StandardAbilityHandlers.registerAll(this);
    }

    /**
     * Installs {@code handler} for {@code kind}, replacing any previous one.
     */
    public void register(EffectKind kind, AbilityHandler handler) {
        handlers.put(kind, handler);
    }

    public GameState fire(TriggerMoment moment, GameState state, Collection<BoardPosition> subjects,
                          String actingPlayerId, List<GameEvent> events) {
        return fire(moment, state, subjects, actingPlayerId, null, events);
    }

    public GameState fire(TriggerMoment moment, GameState state, Collection<BoardPosition> subjects,
                          String actingPlayerId, BoardPosition relatedPosition, List<GameEvent> events) {
        List<BoardPosition> ordered = subjects.stream().distinct().sorted(BoardPosition.SCAN_ORDER).toList();
        GameState current = state;
        for (BoardPosition position : ordered) {
            if (!current.isActive()) {
                break;
            }
            BoardCell cell = current.getBoard().cellAt(position);
            if (!cell.isOccupied()) {
                continue;
            }
            InGameCard card = current.getCards().get(cell.getCardInstanceId());
            AbilityDescriptor ability = card == null ? null : card.ability();
            if (ability == null || !ability.firesOn(moment)) {
                continue;
            }
            AbilityEffect effect = ability.effect();
            String ownerId = cell.getOwnerId();
            if (!AbilityTargets.holds(effect.condition(), current, position, ownerId)) {
                continue;
            }
            AbilityHandler handler = handlers.get(effect.kind());
            if (handler == null) {
                log.warn("No handler registered for effect {} (card {})", effect.kind(), card.instanceId());
                continue;
            }

            List<GameEvent> produced = new ArrayList<>();
            produced.add(GameEvent.of(EventType.ABILITY_TRIGGERED, ownerId, card.instanceId(), position,
                    ability.name() + "@" + moment));
            try {
                current = handler.apply(new AbilityInvocation(current.copy(), position, ownerId, actingPlayerId,
                        moment, card, effect, relatedPosition, produced));
                events.addAll(produced);
                log.debug("Ability {} of {} fired on {} at {}", ability.name(), card.instanceId(), moment, position);
            } catch (RuntimeException e) {
                log.warn("Ability {} of card {} failed on {}, skipping", ability.name(), card.instanceId(), moment, e);
            }
        }
        return current;
    }
}
