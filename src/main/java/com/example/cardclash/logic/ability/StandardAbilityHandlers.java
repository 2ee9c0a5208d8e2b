package com.example.cardclash.logic.ability;

import com.example.cardclash.model.domain.AbilityEffect;
import com.example.cardclash.model.domain.BoardCell;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.CellState;
import com.example.cardclash.model.domain.EffectKind;
import com.example.cardclash.model.domain.EventType;
import com.example.cardclash.model.domain.GameEvent;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.GameStatus;
import com.example.cardclash.model.domain.PlayerState;
import com.example.cardclash.model.domain.Power;
import com.example.cardclash.model.domain.TemporaryEffect;
import com.example.cardclash.model.domain.TerminationReason;
import com.example.cardclash.model.domain.TileEffect;
import com.example.cardclash.model.domain.TileStatus;

import java.util.List;

/**
 * Built-in handler for every {@link EffectKind}.
 */
final class StandardAbilityHandlers {

    private StandardAbilityHandlers() {
    }

    static void registerAll(AbilityRegistry registry) {
        registry.register(EffectKind.POWER_CHANGE, StandardAbilityHandlers::powerChange);
        registry.register(EffectKind.DRAW_CARD, StandardAbilityHandlers::drawCard);
        registry.register(EffectKind.FLIP_TARGETS, StandardAbilityHandlers::flipTargets);
        registry.register(EffectKind.GRANT_IMMUNITY, StandardAbilityHandlers::grantImmunity);
        registry.register(EffectKind.CURSE_TILES, inv -> markTiles(inv, TileStatus.CURSED));
        registry.register(EffectKind.BLESS_TILES, inv -> markTiles(inv, TileStatus.BLESSED));
        registry.register(EffectKind.BLOCK_TILES, inv -> markTiles(inv, TileStatus.BLOCKED));
        registry.register(EffectKind.END_MATCH, StandardAbilityHandlers::endMatch);
    }

    static GameState powerChange(AbilityInvocation inv) {
        GameState state = inv.state();
        AbilityEffect effect = inv.effect();
        for (BoardPosition target : targets(inv)) {
            BoardCell cell = state.getBoard().cellAt(target);
            if (!cell.isOccupied()) {
                continue;
            }
            Power before = cell.getPower();
            Power after = before.shift(effect.magnitude());
            cell.setPower(after);
            if (effect.duration() > 0) {
                cell.getTemporaryEffects().add(
                        new TemporaryEffect(after.minus(before), effect.duration(), inv.card().instanceId()));
            }
            if (!cell.isImmune()) {
                cell.setState(effect.magnitude() >= 0 ? CellState.BUFFED : CellState.DEBUFFED);
            }
            inv.events().add(GameEvent.of(EventType.POWER_CHANGED, inv.ownerId(), cell.getCardInstanceId(), target,
                    String.format("%+d", effect.magnitude())));
        }
        return state;
    }

    static GameState drawCard(AbilityInvocation inv) {
        GameState state = inv.state();
        PlayerState owner = state.player(inv.ownerId());
        int count = Math.max(1, inv.effect().magnitude());
        for (int i = 0; i < count; i++) {
            if (owner.getHand().size() >= state.getMaxHandSize() || owner.getDeck().isEmpty()) {
                break;
            }
            String drawn = owner.getDeck().remove(0);
            owner.getHand().add(drawn);
            inv.events().add(GameEvent.of(EventType.CARD_DRAWN, owner.getUserId(), drawn, null));
        }
        return state;
    }

    // Direct ownership change; flips made here never start further combat
    static GameState flipTargets(AbilityInvocation inv) {
        GameState state = inv.state();
        for (BoardPosition target : targets(inv)) {
            BoardCell cell = state.getBoard().cellAt(target);
            if (!AbilityTargets.isEnemy(cell, inv.ownerId()) || cell.isImmune()) {
                continue;
            }
            cell.setOwnerId(inv.ownerId());
            inv.events().add(GameEvent.of(EventType.CARD_FLIPPED, inv.ownerId(), cell.getCardInstanceId(), target,
                    inv.card().name()));
        }
        return state;
    }

    static GameState grantImmunity(AbilityInvocation inv) {
        GameState state = inv.state();
        for (BoardPosition target : targets(inv)) {
            BoardCell cell = state.getBoard().cellAt(target);
            if (!cell.isOccupied()) {
                continue;
            }
            cell.setState(CellState.IMMUNE);
            cell.setStateTurnsLeft(Math.max(0, inv.effect().duration()));
            inv.events().add(GameEvent.of(EventType.POWER_CHANGED, inv.ownerId(), cell.getCardInstanceId(), target,
                    "immune"));
        }
        return state;
    }

    static GameState markTiles(AbilityInvocation inv, TileStatus status) {
        GameState state = inv.state();
        AbilityEffect effect = inv.effect();
        int turns = Math.max(1, effect.duration());
        for (BoardPosition target : targets(inv)) {
            BoardCell cell = state.getBoard().cellAt(target);
            if (cell.isOccupied()) {
                continue;
            }
            cell.setTileEffect(new TileEffect(status, Math.abs(effect.magnitude()), turns, inv.ownerId()));
            inv.events().add(GameEvent.of(EventType.TILE_EFFECT_APPLIED, inv.ownerId(), null, target,
                    status.name()));
        }
        return state;
    }

    static GameState endMatch(AbilityInvocation inv) {
        GameState state = inv.state();
        String winner = inv.ownerId();
        state.setStatus(winner.equals(state.getPlayer1().getUserId()) ? GameStatus.PLAYER1_WIN : GameStatus.PLAYER2_WIN);
        state.setWinnerId(winner);
        state.setTerminationReason(TerminationReason.COMPLETED);
        inv.events().add(GameEvent.of(EventType.GAME_OVER, winner, inv.card().instanceId(), inv.position(),
                inv.card().name()));
        return state;
    }

    private static List<BoardPosition> targets(AbilityInvocation inv) {
        return AbilityTargets.resolve(inv.state(), inv.position(), inv.ownerId(), inv.effect().target());
    }
}
