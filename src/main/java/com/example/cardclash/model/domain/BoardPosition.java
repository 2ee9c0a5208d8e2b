package com.example.cardclash.model.domain;

import java.util.Comparator;

// x is the column, y is the row; (0,0) is the top-left cell
public record BoardPosition(int x, int y) {

    /** Row by row, left to right. */
    public static final Comparator<BoardPosition> SCAN_ORDER =
            Comparator.comparingInt(BoardPosition::y).thenComparingInt(BoardPosition::x);

    public BoardPosition neighbor(Direction direction) {
        return new BoardPosition(x + direction.dx(), y + direction.dy());
    }

    public boolean isCorner(int size) {
        return (x == 0 || x == size - 1) && (y == 0 || y == size - 1);
    }

    public boolean isCenter(int size) {
        int low = (size - 1) / 2;
        int high = size / 2;
        return x >= low && x <= high && y >= low && y <= high;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
