package com.example.cardclash.service;

import com.example.cardclash.common.GamePersistenceException;
import com.example.cardclash.common.IllegalMoveException;
import com.example.cardclash.common.MatchNotFoundException;
import com.example.cardclash.config.CardClashProperties;
import com.example.cardclash.logic.GameEngine;
import com.example.cardclash.logic.ai.OpponentHeuristic;
import com.example.cardclash.model.domain.AiMove;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.MoveResult;
import com.example.cardclash.model.domain.TerminationReason;
import com.example.cardclash.model.dto.ActionRequest;
import com.example.cardclash.model.dto.EventsPayload;
import com.example.cardclash.model.dto.GameEndPayload;
import com.example.cardclash.model.dto.GameStateView;
import com.example.cardclash.model.dto.JoinedPayload;
import com.example.cardclash.model.dto.MatchMessage;
import com.example.cardclash.model.dto.MessageType;
import com.example.cardclash.model.dto.PlayerJoinedPayload;
import com.example.cardclash.model.dto.StartTurnPayload;
import com.example.cardclash.ws.WebSocketDisconnectHelper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Real-time lifecycle of live matches: attaching connections, turn timers with escalating
 * penalties, AI moves on timeout, disconnect grace windows and finalization.
 * <p>
 * Everything that touches one match runs under that match's {@link MatchRoom} monitor, so
 * actions and timer callbacks of a match are applied one at a time while different matches
 * proceed in parallel. Timer callbacks re-check their generation or token under the lock and
 * do nothing when they lost a race.
 */
@Slf4j
@Service
public class MatchSessionService {

    public static final String MATCH_DESTINATION = "/queue/match";

    private final Map<String, MatchRoom> rooms = new ConcurrentHashMap<>();
    private final Map<String, String> activeMatchByUser = new ConcurrentHashMap<>();

    private final GameEngine gameEngine;
    private final OpponentHeuristic opponentHeuristic;
    private final TurnTimerService turnTimerService;
    private final GamePersistenceService gamePersistenceService;
    private final RewardsNotifier rewardsNotifier;
    private final SimpMessagingTemplate messagingTemplate;
    private final WebSocketDisconnectHelper disconnectHelper;
    private final CardClashProperties properties;

    public MatchSessionService(GameEngine gameEngine,
                               OpponentHeuristic opponentHeuristic,
                               TurnTimerService turnTimerService,
                               GamePersistenceService gamePersistenceService,
                               RewardsNotifier rewardsNotifier,
                               SimpMessagingTemplate messagingTemplate,
                               WebSocketDisconnectHelper disconnectHelper,
                               CardClashProperties properties) {
        this.gameEngine = gameEngine;
        this.opponentHeuristic = opponentHeuristic;
        this.turnTimerService = turnTimerService;
        this.gamePersistenceService = gamePersistenceService;
        this.rewardsNotifier = rewardsNotifier;
        this.messagingTemplate = messagingTemplate;
        this.disconnectHelper = disconnectHelper;
        this.properties = properties;
    }

    /**
     * Matches that were running when the server stopped are reopened and wait for both players
     * to join again, under the usual join timeout.
     */
    @PostConstruct
    public void restoreActiveMatches() {
        for (GameState state : gamePersistenceService.loadActiveGames()) {
            openRoom(state);
            log.info("Restored match {} from storage, waiting for players", state.getMatchId());
        }
    }

    // --- Lifecycle ---

    /**
     * Stores a freshly initialized state under a new match id and opens its room.
     *
     * @return the match id
     */
    public String openMatch(GameState initialState) {
        GameState state = initialState.copy();
        state.setMatchId(UUID.randomUUID().toString());
        gamePersistenceService.save(state);
        openRoom(state);
        log.info("Match {} created: {} vs {}", state.getMatchId(),
                state.getPlayer1().getUserId(), state.getPlayer2().getUserId());
        return state.getMatchId();
    }

    private void openRoom(GameState state) {
        MatchRoom room = new MatchRoom(state, new TurnClock(properties.getSession().getTurnDurationsSeconds()));
        synchronized (room) {
            rooms.put(room.getMatchId(), room);
            for (String userId : room.participants()) {
                activeMatchByUser.put(userId, room.getMatchId());
            }
            room.setJoinTimer(turnTimerService.schedule(properties.getSession().getJoinTimeoutSeconds(),
                    () -> handleJoinTimeout(room.getMatchId())));
        }
    }

    public Optional<String> activeMatchOf(String userId) {
        return Optional.ofNullable(activeMatchByUser.get(userId));
    }

    public boolean isLive(String matchId) {
        return rooms.containsKey(matchId);
    }

    /**
     * Attaches {@code sessionId} as the participant's connection. An earlier connection of the
     * same participant is told it was replaced and closed. A participant coming back inside the
     * grace window keeps the match as it was; the running turn timer is not reset.
     */
    public void join(String matchId, String userId, String sessionId) {
        MatchRoom room = requireRoom(matchId, userId);
        synchronized (room) {
            if (room.isFinished()) {
                throw new MatchNotFoundException(matchId);
            }

            String previous = room.attach(userId, sessionId);
            if (previous != null && !previous.equals(sessionId)) {
                log.info("User {} opened a second connection to match {}, evicting session {}",
                        userId, matchId, previous);
                disconnectHelper.sendToSession(userId, previous, MATCH_DESTINATION,
                        new MatchMessage(matchId, MessageType.SESSION_REPLACED, null));
                disconnectHelper.forceDisconnect(previous);
            }

            ScheduledFuture<?> grace = room.closeGraceWindow(userId);
            if (grace != null) {
                turnTimerService.cancel(grace);
                log.info("User {} reconnected to match {} within the grace window", userId, matchId);
            }

            send(room, userId, MessageType.JOINED,
                    new JoinedPayload(GameStateView.of(room.getState(), userId), room.slotOf(userId)));
            for (String other : room.participants()) {
                if (!other.equals(userId)) {
                    send(room, other, MessageType.PLAYER_JOINED, new PlayerJoinedPayload(userId, room.slotOf(userId)));
                }
            }

            if (room.getPhase() == SessionPhase.AWAITING_PLAYERS && room.allAttached()) {
                room.setPhase(SessionPhase.ACTIVE);
                turnTimerService.cancel(room.getJoinTimer());
                room.setJoinTimer(null);
                log.info("Both players joined match {}, starting", matchId);
                startTurn(room);
            } else if (room.getPhase() == SessionPhase.ACTIVE) {
                TurnClock clock = room.getTurnClock();
                send(room, userId, MessageType.START_TURN, new StartTurnPayload(room.getState().getCurrentPlayerId(),
                        turnTimerService.remainingSeconds(clock), room.getState().getTurnNumber()));
            }
        }
    }

    /**
     * Applies a player action. Illegal moves and failed saves throw and leave the match as it was.
     */
    public void action(String matchId, String userId, ActionRequest request) {
        MatchRoom room = requireRoom(matchId, userId);
        synchronized (room) {
            if (room.isFinished() || room.getPhase() != SessionPhase.ACTIVE) {
                throw new IllegalMoveException("Match " + matchId + " is not in progress");
            }
            if (request.getActionType() == null) {
                throw new IllegalArgumentException("actionType is required");
            }
            GameState state = room.getState();

            switch (request.getActionType()) {
                case SURRENDER -> {
                    GameState finalState = gameEngine.surrender(state, userId);
                    gamePersistenceService.save(finalState);
                    log.info("User {} surrendered match {}", userId, matchId);
                    finalizeMatch(room, finalState, TerminationReason.SURRENDER);
                }
                case PLACE_CARD -> applyResult(room, userId,
                        gameEngine.placeCard(state, userId, request.getCardInstanceId(), request.getPosition()), false);
                case END_TURN -> applyResult(room, userId, gameEngine.endTurn(state, userId), false);
            }
        }
    }

    public void animationsComplete(String matchId, String userId) {
        // Advisory only, the server never waits for it
        log.debug("User {} finished animations in match {}", userId, matchId);
    }

    /**
     * Handles a dropped connection. Ignored unless {@code sessionId} is the participant's
     * attached connection, so closing a replaced connection does not count.
     */
    public void onDisconnect(String userId, String sessionId) {
        String matchId = activeMatchByUser.get(userId);
        MatchRoom room = matchId == null ? null : rooms.get(matchId);
        if (room == null) {
            return;
        }
        synchronized (room) {
            if (room.isFinished() || sessionId == null || !sessionId.equals(room.sessionOf(userId))) {
                return;
            }
            room.detach(userId);
            if (room.getPhase() != SessionPhase.ACTIVE) {
                return;
            }
            int graceSeconds = properties.getSession().getGraceSeconds();
            long token = room.openGraceWindow(userId);
            room.getGraceTimers().put(userId,
                    turnTimerService.schedule(graceSeconds, () -> handleGraceExpired(matchId, userId, token)));
            log.info("User {} disconnected from match {}, {}s to come back", userId, matchId, graceSeconds);
        }
    }

    public GameStateView viewFor(String matchId, String userId) {
        MatchRoom room = rooms.get(matchId);
        GameState state;
        if (room != null) {
            synchronized (room) {
                state = room.getState();
            }
        } else {
            state = gamePersistenceService.load(matchId).orElseThrow(() -> new MatchNotFoundException(matchId));
        }
        if (!state.isParticipant(userId)) {
            throw new MatchNotFoundException(matchId);
        }
        return GameStateView.of(state, userId);
    }

    // --- Timer callbacks ---

    void handleTurnTimeout(String matchId, long generation) {
        MatchRoom room = rooms.get(matchId);
        if (room == null) {
            return;
        }
        synchronized (room) {
            if (room.isFinished() || !room.getTurnClock().isCurrent(generation)) {
                return;
            }
            GameState state = room.getState();
            String timedOut = state.getCurrentPlayerId();
            room.getTurnClock().recordTimeout(timedOut);
            log.info("Turn timeout for {} in match {} (strikes={})", timedOut, matchId,
                    room.getTurnClock().strikesOf(timedOut));

            try {
                Optional<AiMove> move = opponentHeuristic.chooseMove(state, timedOut,
                        properties.getAi().getTimeoutDifficulty());
                MoveResult result = move.isPresent()
                        ? gameEngine.placeCard(state, timedOut, move.get().cardInstanceId(), move.get().position())
                        : gameEngine.endTurn(state, timedOut);
                applyResult(room, timedOut, result, true);
            } catch (RuntimeException e) {
                // Keep the match moving; the same player gets another (shorter) turn
                log.error("Forced move for {} in match {} failed", timedOut, matchId, e);
                startTurn(room);
            }
        }
    }

    void handleGraceExpired(String matchId, String userId, long token) {
        MatchRoom room = rooms.get(matchId);
        if (room == null) {
            return;
        }
        synchronized (room) {
            if (room.isFinished() || !room.isGraceCurrent(userId, token)) {
                return;
            }
            room.closeGraceWindow(userId);
            log.info("User {} did not return to match {}, forfeiting", userId, matchId);
            GameState finalState = gameEngine.forfeit(room.getState(), userId);
            saveQuietly(finalState);
            finalizeMatch(room, finalState, TerminationReason.DISCONNECT);
        }
    }

    void handleJoinTimeout(String matchId) {
        MatchRoom room = rooms.get(matchId);
        if (room == null) {
            return;
        }
        synchronized (room) {
            if (room.isFinished() || room.getPhase() != SessionPhase.AWAITING_PLAYERS) {
                return;
            }
            log.info("Match {} aborted, players did not join in time", matchId);
            GameState finalState = gameEngine.abort(room.getState());
            saveQuietly(finalState);
            finalizeMatch(room, finalState, TerminationReason.ABORTED);
        }
    }

    // --- Internals, all called with the room lock held ---

    private void applyResult(MatchRoom room, String actorId, MoveResult result, boolean serverForced) {
        GameState next = result.state();
        // Store first: if this fails nothing below happens and the old state stands
        gamePersistenceService.save(next);
        room.setState(next);
        if (!serverForced) {
            room.getTurnClock().resetStrikes(actorId);
        }

        for (String userId : room.participants()) {
            send(room, userId, MessageType.EVENTS,
                    new EventsPayload(result.events(), GameStateView.of(next, userId), serverForced));
        }

        if (next.isActive()) {
            startTurn(room);
        } else {
            TerminationReason reason = next.getTerminationReason() == null
                    ? TerminationReason.COMPLETED : next.getTerminationReason();
            finalizeMatch(room, next, reason);
        }
    }

    private void startTurn(MatchRoom room) {
        GameState state = room.getState();
        String current = state.getCurrentPlayerId();
        int seconds = room.getTurnClock().allowedSecondsFor(current);
        String matchId = room.getMatchId();
        turnTimerService.scheduleTurnTimer(room.getTurnClock(), current, seconds,
                generation -> () -> handleTurnTimeout(matchId, generation));

        StartTurnPayload payload = new StartTurnPayload(current, seconds, state.getTurnNumber());
        for (String userId : room.participants()) {
            send(room, userId, MessageType.START_TURN, payload);
        }
    }

    /**
     * Idempotent: the first caller tears the room down, later callers return immediately.
     */
    private void finalizeMatch(MatchRoom room, GameState finalState, TerminationReason reason) {
        if (room.isFinished()) {
            return;
        }
        room.setFinished(true);
        room.setState(finalState);
        room.setPhase(reason == TerminationReason.ABORTED ? SessionPhase.ABORTED : SessionPhase.COMPLETED);

        turnTimerService.cancelTurnTimer(room.getTurnClock());
        turnTimerService.cancel(room.getJoinTimer());
        room.setJoinTimer(null);
        for (String userId : room.participants()) {
            turnTimerService.cancel(room.closeGraceWindow(userId));
        }

        rooms.remove(room.getMatchId(), room);
        for (String userId : room.participants()) {
            activeMatchByUser.remove(userId, room.getMatchId());
        }

        GameEndPayload payload = new GameEndPayload(finalState.getWinnerId(), reason);
        for (String userId : room.participants()) {
            send(room, userId, MessageType.GAME_END, payload);
        }
        log.info("Match {} finalized: winner={}, reason={}", room.getMatchId(), finalState.getWinnerId(), reason);

        try {
            rewardsNotifier.matchFinished(room.getMatchId(), finalState, reason);
        } catch (RuntimeException e) {
            log.error("Rewards hand-off failed for match {}", room.getMatchId(), e);
        }
    }

    // Used where no client is waiting for an answer; the match still ends in memory
    private void saveQuietly(GameState state) {
        try {
            gamePersistenceService.save(state);
        } catch (GamePersistenceException e) {
            log.error("Could not store final state of match {}", state.getMatchId(), e);
        }
    }

    private void send(MatchRoom room, String userId, MessageType type, Object payload) {
        messagingTemplate.convertAndSendToUser(userId, MATCH_DESTINATION,
                new MatchMessage(room.getMatchId(), type, payload));
    }

    private MatchRoom requireRoom(String matchId, String userId) {
        MatchRoom room = rooms.get(matchId);
        if (room == null || !room.isParticipant(userId)) {
            throw new MatchNotFoundException(matchId);
        }
        return room;
    }
}
