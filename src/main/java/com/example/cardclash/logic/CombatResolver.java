package com.example.cardclash.logic;

import com.example.cardclash.model.domain.Board;
import com.example.cardclash.model.domain.BoardCell;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.Direction;
import com.example.cardclash.model.domain.Power;

import java.util.ArrayList;
import java.util.List;

/**
 * Directional combat. A card placed at {@code position} attacks each orthogonal neighbour held by
 * another player: its side facing the neighbour against the neighbour's opposite side. Only a
 * strictly greater value wins; immune cells never lose.
 */
public final class CombatResolver {

    private CombatResolver() {
    }

    /**
     * Neighbours that {@code attacker} would capture from {@code position}, in
     * {@link Direction} order (top, right, bottom, left). Nothing on the board is changed.
     */
    public static List<BoardPosition> captures(Board board, BoardPosition position, Power attacker, String playerId) {
        List<BoardPosition> result = new ArrayList<>(4);
        for (Direction direction : Direction.values()) {
            BoardPosition neighborPos = position.neighbor(direction);
            if (!board.contains(neighborPos)) {
                continue;
            }
            BoardCell neighbor = board.cellAt(neighborPos);
            if (!neighbor.isOccupied() || playerId.equals(neighbor.getOwnerId()) || neighbor.isImmune()) {
                continue;
            }
            if (attacker.get(direction) > neighbor.getPower().get(direction.opposite())) {
                result.add(neighborPos);
            }
        }
        return result;
    }
}
