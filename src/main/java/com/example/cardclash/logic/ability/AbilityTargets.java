package com.example.cardclash.logic.ability;

import com.example.cardclash.model.domain.Board;
import com.example.cardclash.model.domain.BoardCell;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.EffectCondition;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.TargetScope;

import java.util.List;
import java.util.function.Predicate;

/**
 * Target selection and condition checks shared by the ability handlers. "Allies" and "enemies"
 * are relative to the owner of the cell whose ability fired.
 */
final class AbilityTargets {

    private AbilityTargets() {
    }

    static List<BoardPosition> resolve(GameState state, BoardPosition origin, String ownerId, TargetScope scope) {
        Board board = state.getBoard();
        Predicate<BoardPosition> ally = p -> board.cellAt(p).isOccupied() && ownerId.equals(board.cellAt(p).getOwnerId());
        Predicate<BoardPosition> enemy = p -> board.cellAt(p).isOccupied() && !ownerId.equals(board.cellAt(p).getOwnerId());
        Predicate<BoardPosition> empty = p -> !board.cellAt(p).isOccupied();

        return switch (scope) {
            case SELF -> List.of(origin);
            case ADJACENT_ALLIES -> board.neighbors(origin).stream().filter(ally).sorted(BoardPosition.SCAN_ORDER).toList();
            case ADJACENT_ENEMIES -> board.neighbors(origin).stream().filter(enemy).sorted(BoardPosition.SCAN_ORDER).toList();
            case ADJACENT_ALL -> board.neighbors(origin).stream().filter(ally.or(enemy)).sorted(BoardPosition.SCAN_ORDER).toList();
            case ADJACENT_EMPTY -> board.neighbors(origin).stream().filter(empty).sorted(BoardPosition.SCAN_ORDER).toList();
            case ALL_ALLIES -> board.positions().stream().filter(ally.and(p -> !p.equals(origin))).toList();
            case ALL_ENEMIES -> board.positions().stream().filter(enemy).toList();
            case ALL_EMPTY -> board.positions().stream().filter(empty).toList();
        };
    }

    static boolean holds(EffectCondition condition, GameState state, BoardPosition origin, String ownerId) {
        Board board = state.getBoard();
        return switch (condition) {
            case ALWAYS -> true;
            case ADJACENT_ENEMY_PRESENT -> board.neighbors(origin).stream()
                    .map(board::cellAt)
                    .anyMatch(cell -> cell.isOccupied() && !ownerId.equals(cell.getOwnerId()));
            case OWNER_TRAILING -> board.countOwnedBy(ownerId) < board.countOwnedBy(opponentId(state, ownerId));
            case OPPONENT_WIPED_OUT -> board.countOwnedBy(opponentId(state, ownerId)) == 0;
        };
    }

    static String opponentId(GameState state, String ownerId) {
        return state.opponentOf(ownerId).getUserId();
    }

    static boolean isEnemy(BoardCell cell, String ownerId) {
        return cell.isOccupied() && !ownerId.equals(cell.getOwnerId());
    }
}
