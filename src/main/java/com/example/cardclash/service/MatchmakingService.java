package com.example.cardclash.service;

import com.example.cardclash.common.MatchmakingException;
import com.example.cardclash.config.CardClashProperties;
import com.example.cardclash.logic.GameEngine;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.dto.MatchmakingStatus;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * First-in, first-paired queue. The player who completes a pair becomes player 1 and moves
 * first; the waiting player is told about the match on {@code /user/queue/matchmaking}.
 */
@Slf4j
@Service
public class MatchmakingService {

    public static final String MATCHMAKING_DESTINATION = "/queue/matchmaking";

    @Data
    private static class WaitingPlayer {
        private final String userId;
        private final String deckRef;
        private final List<String> cards;
    }

    private final Deque<WaitingPlayer> waitingQueue = new ConcurrentLinkedDeque<>();
    private final GameEngine gameEngine;
    private final MatchSessionService matchSessionService;
    private final DeckProvider deckProvider;
    private final SimpMessagingTemplate messagingTemplate;
    private final int minDeckSize;

    public MatchmakingService(GameEngine gameEngine,
                              MatchSessionService matchSessionService,
                              DeckProvider deckProvider,
                              SimpMessagingTemplate messagingTemplate,
                              CardClashProperties properties) {
        this.gameEngine = gameEngine;
        this.matchSessionService = matchSessionService;
        this.deckProvider = deckProvider;
        this.messagingTemplate = messagingTemplate;
        this.minDeckSize = properties.getMatchmaking().getMinDeckSize();
    }

    /**
     * @throws MatchmakingException     if the user is already queued or playing
     * @throws IllegalArgumentException if the deck is unknown or too small
     */
    public synchronized MatchmakingStatus join(String userId, String deckRef) {
        if (isQueued(userId)) {
            throw new MatchmakingException("Already in the matchmaking queue");
        }
        if (matchSessionService.activeMatchOf(userId).isPresent()) {
            throw new MatchmakingException("Already in an active match");
        }
        List<String> cards = deckProvider.cardsOf(deckRef, userId);
        if (cards.size() < minDeckSize) {
            throw new IllegalArgumentException("Deck must contain at least " + minDeckSize + " cards");
        }

        WaitingPlayer opponent = waitingQueue.poll();
        if (opponent == null) {
            waitingQueue.add(new WaitingPlayer(userId, deckRef, cards));
            log.info("User {} queued with deck {}", userId, deckRef);
            return MatchmakingStatus.queued();
        }

        String matchId;
        try {
            GameState state = gameEngine.initializeGame(cards, opponent.getCards(), userId, opponent.getUserId());
            matchId = matchSessionService.openMatch(state);
        } catch (RuntimeException e) {
            // the waiting player keeps their place
            waitingQueue.offerFirst(opponent);
            throw e;
        }
        log.info("Paired {} with {} in match {}", userId, opponent.getUserId(), matchId);

        MatchmakingStatus matched = MatchmakingStatus.matched(matchId);
        messagingTemplate.convertAndSendToUser(opponent.getUserId(), MATCHMAKING_DESTINATION, matched);
        return matched;
    }

    public MatchmakingStatus status(String userId) {
        if (isQueued(userId)) {
            return MatchmakingStatus.queued();
        }
        return matchSessionService.activeMatchOf(userId)
                .map(MatchmakingStatus::matched)
                .orElseGet(MatchmakingStatus::idle);
    }

    public synchronized MatchmakingStatus leave(String userId) {
        if (waitingQueue.removeIf(p -> p.getUserId().equals(userId))) {
            log.info("User {} left the matchmaking queue", userId);
        }
        return MatchmakingStatus.idle();
    }

    public int queueSize() {
        return waitingQueue.size();
    }

    private boolean isQueued(String userId) {
        return waitingQueue.stream().anyMatch(p -> p.getUserId().equals(userId));
    }
}
