package com.example.cardclash.model.domain;

/**
 * A status laid on a board cell by an ability. {@code turnsLeft} counts down at every turn end;
 * the effect is removed when it reaches zero.
 */
public record TileEffect(TileStatus status, int magnitude, int turnsLeft, String appliedBy) {

    public TileEffect tick() {
        return new TileEffect(status, magnitude, turnsLeft - 1, appliedBy);
    }

    public boolean expired() {
        return turnsLeft <= 0;
    }
}
