package com.example.cardclash.service;

import com.example.cardclash.model.domain.GameState;
import lombok.Getter;
import lombok.Setter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Live session of one match. All access goes through {@code synchronized (room)}.
 */
@Getter
@Setter
class MatchRoom {

    private final String matchId;
    private final String player1Id;
    private final String player2Id;
    private final TurnClock turnClock;

    private SessionPhase phase = SessionPhase.AWAITING_PLAYERS;
    private GameState state;
    private ScheduledFuture<?> joinTimer;
    private boolean finished;

    // userId -> STOMP session id of the attached connection
    private final Map<String, String> sessions = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> graceTimers = new HashMap<>();
    private final Map<String, Long> graceTokens = new HashMap<>();
    private long graceSequence;

    MatchRoom(GameState state, TurnClock turnClock) {
        this.matchId = state.getMatchId();
        this.player1Id = state.getPlayer1().getUserId();
        this.player2Id = state.getPlayer2().getUserId();
        this.state = state;
        this.turnClock = turnClock;
    }

    boolean isParticipant(String userId) {
        return player1Id.equals(userId) || player2Id.equals(userId);
    }

    List<String> participants() {
        return List.of(player1Id, player2Id);
    }

    int slotOf(String userId) {
        return player1Id.equals(userId) ? 1 : 2;
    }

    /**
     * @return the session this one replaces, or null
     */
    String attach(String userId, String sessionId) {
        return sessions.put(userId, sessionId);
    }

    void detach(String userId) {
        sessions.remove(userId);
    }

    String sessionOf(String userId) {
        return sessions.get(userId);
    }

    boolean allAttached() {
        return sessions.containsKey(player1Id) && sessions.containsKey(player2Id);
    }

    long openGraceWindow(String userId) {
        long token = ++graceSequence;
        graceTokens.put(userId, token);
        return token;
    }

    /**
     * @return the pending grace timer of {@code userId}, if any; its token is invalidated either way
     */
    ScheduledFuture<?> closeGraceWindow(String userId) {
        graceTokens.remove(userId);
        return graceTimers.remove(userId);
    }

    boolean isGraceCurrent(String userId, long token) {
        Long current = graceTokens.get(userId);
        return current != null && current == token;
    }
}
