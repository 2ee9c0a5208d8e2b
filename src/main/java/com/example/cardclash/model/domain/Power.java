package com.example.cardclash.model.domain;

/**
 * Directional power values of a card.
 */
public record Power(int top, int right, int bottom, int left) {

    public static final Power ZERO = new Power(0, 0, 0, 0);

    public int get(Direction direction) {
        return switch (direction) {
            case TOP -> top;
            case RIGHT -> right;
            case BOTTOM -> bottom;
            case LEFT -> left;
        };
    }

    public Power plus(Power other) {
        return new Power(top + other.top, right + other.right, bottom + other.bottom, left + other.left);
    }

    public Power minus(Power other) {
        return new Power(top - other.top, right - other.right, bottom - other.bottom, left - other.left);
    }

    /**
     * Takes back a recorded change. Sides never drop below zero.
     */
    public Power revert(Power delta) {
        return new Power(Math.max(0, top - delta.top), Math.max(0, right - delta.right),
                Math.max(0, bottom - delta.bottom), Math.max(0, left - delta.left));
    }

    /**
     * Adds {@code delta} to every side. Sides never drop below zero.
     */
    public Power shift(int delta) {
        return new Power(Math.max(0, top + delta), Math.max(0, right + delta),
                Math.max(0, bottom + delta), Math.max(0, left + delta));
    }

    public int total() {
        return top + right + bottom + left;
    }
}
