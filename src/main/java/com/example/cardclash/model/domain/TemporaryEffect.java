package com.example.cardclash.model.domain;

// Power change on a placed card that is reverted once turnsLeft runs out
public record TemporaryEffect(Power delta, int turnsLeft, String sourceCardId) {

    public TemporaryEffect tick() {
        return new TemporaryEffect(delta, turnsLeft - 1, sourceCardId);
    }
}
