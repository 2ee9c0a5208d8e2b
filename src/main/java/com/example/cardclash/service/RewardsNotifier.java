package com.example.cardclash.service;

import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.TerminationReason;

/**
 * Hand-off point for finished matches. Implementations must not block the caller.
 */
public interface RewardsNotifier {

    void matchFinished(String matchId, GameState finalState, TerminationReason reason);
}
