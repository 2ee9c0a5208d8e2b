package com.example.cardclash.model.dto;

import com.example.cardclash.model.domain.Board;
import com.example.cardclash.model.domain.BoardCell;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.GameStatus;
import com.example.cardclash.model.domain.InGameCard;
import com.example.cardclash.model.domain.PlayerState;
import com.example.cardclash.model.domain.TerminationReason;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * What one participant is allowed to see of a match: the board, their own hand, and only the
 * sizes of the opponent's hand and of both decks.
 */
@Data
public class GameStateView {
    private String matchId;
    private Board board;
    private PlayerView you;
    private PlayerView opponent;
    private String currentPlayerId;
    private int turnNumber;
    private GameStatus status;
    private int maxHandSize;
    private String winnerId;
    private TerminationReason terminationReason;
    private Map<String, InGameCard> cards = new HashMap<>();

    @Data
    public static class PlayerView {
        private String userId;
        private List<String> hand; // null for the opponent
        private int handCount;
        private int deckCount;
        private int score;
    }

    public static GameStateView of(GameState state, String viewerId) {
        PlayerState self = state.player(viewerId);
        PlayerState other = state.opponentOf(viewerId);

        GameStateView view = new GameStateView();
        view.matchId = state.getMatchId();
        view.board = state.getBoard();
        view.you = playerView(self, true);
        view.opponent = playerView(other, false);
        view.currentPlayerId = state.getCurrentPlayerId();
        view.turnNumber = state.getTurnNumber();
        view.status = state.getStatus();
        view.maxHandSize = state.getMaxHandSize();
        view.winnerId = state.getWinnerId();
        view.terminationReason = state.getTerminationReason();

        for (BoardCell cell : state.getBoard().getCells()) {
            if (cell.isOccupied()) {
                putCard(view, state, cell.getCardInstanceId());
            }
        }
        for (String id : self.getHand()) {
            putCard(view, state, id);
        }
        return view;
    }

    private static void putCard(GameStateView view, GameState state, String id) {
        InGameCard card = state.getCards().get(id);
        if (card != null) {
            view.cards.put(id, card);
        }
    }

    private static PlayerView playerView(PlayerState player, boolean revealHand) {
        PlayerView view = new PlayerView();
        view.userId = player.getUserId();
        view.hand = revealHand ? new ArrayList<>(player.getHand()) : null;
        view.handCount = player.getHand().size();
        view.deckCount = player.getDeck().size();
        view.score = player.getScore();
        return view;
    }
}
