package com.example.cardclash.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Authoritative state of one match. The engine never mutates a state it is given; it works on
 * {@link #copy()} and returns the result.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GameState {

    // Bumped when the stored JSON layout changes
    private int schemaVersion = 1;

    private String matchId;
    private Board board;
    private PlayerState player1;
    private PlayerState player2;
    private String currentPlayerId;
    private int turnNumber;
    private GameStatus status;
    private int maxHandSize;
    private String winnerId;
    private TerminationReason terminationReason;

    // Hydration cache: card-instance id -> resolved attributes
    private Map<String, InGameCard> cards = new HashMap<>();

    @JsonIgnore
    public boolean isActive() {
        return status == GameStatus.ACTIVE;
    }

    public boolean isParticipant(String userId) {
        return userId != null
                && (userId.equals(player1.getUserId()) || userId.equals(player2.getUserId()));
    }

    public PlayerState player(String userId) {
        if (userId != null && userId.equals(player1.getUserId())) {
            return player1;
        }
        if (userId != null && userId.equals(player2.getUserId())) {
            return player2;
        }
        throw new IllegalArgumentException("User " + userId + " is not part of match " + matchId);
    }

    public PlayerState opponentOf(String userId) {
        return player(userId) == player1 ? player2 : player1;
    }

    public void recomputeScores() {
        player1.setScore(board.countOwnedBy(player1.getUserId()));
        player2.setScore(board.countOwnedBy(player2.getUserId()));
    }

    public GameState copy() {
        GameState copy = new GameState();
        copy.schemaVersion = schemaVersion;
        copy.matchId = matchId;
        copy.board = board.copy();
        copy.player1 = player1.copy();
        copy.player2 = player2.copy();
        copy.currentPlayerId = currentPlayerId;
        copy.turnNumber = turnNumber;
        copy.status = status;
        copy.maxHandSize = maxHandSize;
        copy.winnerId = winnerId;
        copy.terminationReason = terminationReason;
        copy.cards = new HashMap<>(cards);
        return copy;
    }
}
