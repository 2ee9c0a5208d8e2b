package com.example.cardclash.service;

import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.TerminationReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Default rewards hand-off: records the result for the rewards pipeline to pick up from the log.
 */
@Slf4j
@Service
public class LoggingRewardsNotifier implements RewardsNotifier {

    @Async
    @Override
    public void matchFinished(String matchId, GameState finalState, TerminationReason reason) {
        log.info("Match {} finished: status={}, winner={}, reason={}, score={}-{}, turns={}",
                matchId, finalState.getStatus(), finalState.getWinnerId(), reason,
                finalState.getPlayer1().getScore(), finalState.getPlayer2().getScore(), finalState.getTurnNumber());
    }
}
