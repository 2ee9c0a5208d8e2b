package com.example.cardclash.logic.ai;

import com.example.cardclash.common.CardNotFoundException;
import com.example.cardclash.logic.CardInstanceHydrator;
import com.example.cardclash.logic.CombatResolver;
import com.example.cardclash.model.domain.AiMove;
import com.example.cardclash.model.domain.Board;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.InGameCard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Picks a placement for a player by scoring every (card in hand, empty cell) pair:
 * <ul>
 *     <li>{@value #FLIP_SCORE} per neighbour the card would capture,</li>
 *     <li>the card's total current power,</li>
 *     <li>{@value #CORNER_BONUS} for a corner, {@value #CENTER_BONUS} for one of the centre cells.</li>
 * </ul>
 * Abilities are not simulated. The move is drawn uniformly from the top candidates, the pool
 * size depending on {@link AiDifficulty}.
 */
@Slf4j
@Component
public class OpponentHeuristic {

    static final int FLIP_SCORE = 100;
    static final int CORNER_BONUS = 50;
    static final int CENTER_BONUS = 30;

    private final CardInstanceHydrator hydrator;
    private final Random random;

    @Autowired
    public OpponentHeuristic(CardInstanceHydrator hydrator) {
        this(hydrator, new Random());
    }

    public OpponentHeuristic(CardInstanceHydrator hydrator, Random random) {
        this.hydrator = hydrator;
        this.random = random;
    }

    /**
     * @return empty when the player has no card to play or no free cell, meaning "pass"
     */
    public Optional<AiMove> chooseMove(GameState state, String playerId, AiDifficulty difficulty) {
        List<AiMove> candidates = scoreCandidates(state, playerId);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int pool = Math.min(difficulty.candidatePool(), candidates.size());
        return Optional.of(candidates.get(random.nextInt(pool)));
    }

    /**
     * All legal placements, best first. Ties keep hand order, then board-scan order.
     */
    List<AiMove> scoreCandidates(GameState state, String playerId) {
        Board board = state.getBoard();
        List<BoardPosition> freeCells = board.emptyPositions().stream()
                .filter(p -> !board.cellAt(p).isBlocked())
                .toList();
        List<AiMove> candidates = new ArrayList<>();
        for (String cardId : state.player(playerId).getHand()) {
            InGameCard card = lookup(state, cardId, playerId);
            if (card == null) {
                continue;
            }
            for (BoardPosition position : freeCells) {
                int flips = CombatResolver.captures(board, position, card.currentPower(), playerId).size();
                int score = flips * FLIP_SCORE + card.currentPower().total() + positionalBonus(position, board.getSize());
                candidates.add(new AiMove(cardId, position, score));
            }
        }
        candidates.sort(Comparator.comparingInt(AiMove::score).reversed());
        return candidates;
    }

    static int positionalBonus(BoardPosition position, int size) {
        if (position.isCorner(size)) {
            return CORNER_BONUS;
        }
        if (position.isCenter(size)) {
            return CENTER_BONUS;
        }
        return 0;
    }

    private InGameCard lookup(GameState state, String cardId, String playerId) {
        InGameCard cached = state.getCards().get(cardId);
        if (cached != null) {
            return cached;
        }
        try {
            return hydrator.resolve(cardId, playerId);
        } catch (CardNotFoundException e) {
            log.warn("AI skipping unresolvable card {} of {}", cardId, playerId);
            return null;
        }
    }
}
