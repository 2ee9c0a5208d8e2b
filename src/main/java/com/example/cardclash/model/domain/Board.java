package com.example.cardclash.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Square grid of cells stored row-major: index = y * size + x. Neighbours are found by index
 * arithmetic; iteration order of {@link #positions()} is the board-scan order.
 */
@Data
@NoArgsConstructor
public class Board {

    public static final int DEFAULT_SIZE = 4;

    private int size;
    private List<BoardCell> cells = new ArrayList<>();

    public Board(int size) {
        this.size = size;
        for (int i = 0; i < size * size; i++) {
            cells.add(new BoardCell());
        }
    }

    public boolean contains(BoardPosition position) {
        return position != null
                && position.x() >= 0 && position.x() < size
                && position.y() >= 0 && position.y() < size;
    }

    public BoardCell cellAt(BoardPosition position) {
        if (!contains(position)) {
            throw new IndexOutOfBoundsException("Position " + position + " is outside the board");
        }
        return cells.get(position.y() * size + position.x());
    }

    /** All positions, top-left to bottom-right. */
    public List<BoardPosition> positions() {
        List<BoardPosition> result = new ArrayList<>(size * size);
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                result.add(new BoardPosition(x, y));
            }
        }
        return result;
    }

    public List<BoardPosition> occupiedPositions() {
        return positions().stream().filter(p -> cellAt(p).isOccupied()).toList();
    }

    public List<BoardPosition> emptyPositions() {
        return positions().stream().filter(p -> !cellAt(p).isOccupied()).toList();
    }

    public List<BoardPosition> neighbors(BoardPosition position) {
        List<BoardPosition> result = new ArrayList<>(4);
        for (Direction direction : Direction.values()) {
            BoardPosition neighbor = position.neighbor(direction);
            if (contains(neighbor)) {
                result.add(neighbor);
            }
        }
        return result;
    }

    public int countOwnedBy(String playerId) {
        int count = 0;
        for (BoardCell cell : cells) {
            if (cell.isOccupied() && playerId.equals(cell.getOwnerId())) {
                count++;
            }
        }
        return count;
    }

    @JsonIgnore
    public boolean isFull() {
        return cells.stream().allMatch(BoardCell::isOccupied);
    }

    public Board copy() {
        Board copy = new Board();
        copy.size = size;
        copy.cells = new ArrayList<>(cells.size());
        for (BoardCell cell : cells) {
            copy.cells.add(cell.copy());
        }
        return copy;
    }
}
