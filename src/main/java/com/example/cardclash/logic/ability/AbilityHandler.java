package com.example.cardclash.logic.ability;

import com.example.cardclash.model.domain.GameState;

@FunctionalInterface
public interface AbilityHandler {

    /**
     * Applies one effect and returns the resulting state. Throwing leaves the pre-ability state in place.
     */
    GameState apply(AbilityInvocation invocation);
}
