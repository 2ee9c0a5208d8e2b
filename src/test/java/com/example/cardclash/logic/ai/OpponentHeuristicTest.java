package com.example.cardclash.logic.ai;

import com.example.cardclash.logic.TestCards;
import com.example.cardclash.model.domain.AiMove;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.TileEffect;
import com.example.cardclash.model.domain.TileStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.example.cardclash.logic.TestCards.card;
import static com.example.cardclash.logic.TestCards.giveHand;
import static com.example.cardclash.logic.TestCards.put;
import static org.junit.jupiter.api.Assertions.*;

class OpponentHeuristicTest {

    private TestCards.MapHydrator hydrator;
    private GameState state;

    @BeforeEach
    void setUp() {
        hydrator = new TestCards.MapHydrator();
        List<String> aliceDeck = hydrator.addDeck("a", "alice", 12, 2);
        List<String> bobDeck = hydrator.addDeck("b", "bob", 12, 2);
        state = TestCards.engine(hydrator).initializeGame(aliceDeck, bobDeck, "alice", "bob");
    }

    private static BoardPosition pos(int x, int y) {
        return new BoardPosition(x, y);
    }

    /** Always answers the last index of the requested range and remembers the bound. */
    private static class LastIndexRandom extends Random {
        private final List<Integer> bounds = new ArrayList<>();

        @Override
        public int nextInt(int bound) {
            bounds.add(bound);
            return bound - 1;
        }
    }

    @Test
    void testHardPicksTheBestScoredMove() {
        giveHand(state, "alice", card("striker", "alice", 5, 5, 5, 5));
        put(state, pos(1, 0), "bob", card("target", "bob", 1, 1, 1, 1));
        OpponentHeuristic heuristic = new OpponentHeuristic(hydrator, new LastIndexRandom());

        Optional<AiMove> move = heuristic.chooseMove(state, "alice", AiDifficulty.HARD);

        assertTrue(move.isPresent());
        // corner next to the enemy: one flip, total power 20, corner bonus
        assertEquals(pos(0, 0), move.get().position());
        assertEquals("striker", move.get().cardInstanceId());
        assertEquals(100 + 20 + 50, move.get().score());
    }

    @Test
    void testCandidatesAreSortedBestFirst() {
        giveHand(state, "alice", card("striker", "alice", 5, 5, 5, 5));
        put(state, pos(1, 0), "bob", card("target", "bob", 1, 1, 1, 1));
        OpponentHeuristic heuristic = new OpponentHeuristic(hydrator, new Random(7));

        List<AiMove> candidates = heuristic.scoreCandidates(state, "alice");

        assertEquals(15, candidates.size());
        assertEquals(170, candidates.get(0).score());
        assertEquals(150, candidates.get(1).score()); // (1,1): flip plus centre
        for (int i = 1; i < candidates.size(); i++) {
            assertTrue(candidates.get(i - 1).score() >= candidates.get(i).score());
        }
    }

    @Test
    void testDifficultyControlsCandidatePool() {
        LastIndexRandom random = new LastIndexRandom();
        OpponentHeuristic heuristic = new OpponentHeuristic(hydrator, random);
        List<AiMove> candidates = heuristic.scoreCandidates(state, "alice");

        Optional<AiMove> medium = heuristic.chooseMove(state, "alice", AiDifficulty.MEDIUM);
        Optional<AiMove> easy = heuristic.chooseMove(state, "alice", AiDifficulty.EASY);

        assertEquals(List.of(3, 5), random.bounds);
        assertEquals(candidates.get(2), medium.orElseThrow());
        assertEquals(candidates.get(4), easy.orElseThrow());
    }

    @Test
    void testPoolShrinksToAvailableCandidates() {
        giveHand(state, "alice", card("only", "alice", 2, 2, 2, 2));
        List<BoardPosition> cells = state.getBoard().positions();
        for (int i = 0; i < 14; i++) {
            String owner = i % 2 == 0 ? "alice" : "bob";
            put(state, cells.get(i), owner, card("f" + i, owner, 9, 9, 9, 9));
        }
        LastIndexRandom random = new LastIndexRandom();

        Optional<AiMove> move = new OpponentHeuristic(hydrator, random).chooseMove(state, "alice", AiDifficulty.EASY);

        assertTrue(move.isPresent());
        assertEquals(List.of(2), random.bounds);
    }

    @Test
    void testNoMoveWithEmptyHandOrFullBoard() {
        OpponentHeuristic heuristic = new OpponentHeuristic(hydrator, new Random(1));

        giveHand(state, "alice");
        assertTrue(heuristic.chooseMove(state, "alice", AiDifficulty.HARD).isEmpty());

        giveHand(state, "alice", card("spare", "alice", 1, 1, 1, 1));
        for (BoardPosition p : state.getBoard().positions()) {
            put(state, p, "bob", card("fill" + p.x() + p.y(), "bob", 1, 1, 1, 1));
        }
        assertTrue(heuristic.chooseMove(state, "alice", AiDifficulty.HARD).isEmpty());
    }

    @Test
    void testBlockedCellsAreNeverChosen() {
        giveHand(state, "alice", card("only", "alice", 2, 2, 2, 2));
        for (BoardPosition p : state.getBoard().positions()) {
            if (!p.equals(pos(1, 2))) {
                state.getBoard().cellAt(p).setTileEffect(new TileEffect(TileStatus.BLOCKED, 0, 2, "bob"));
            }
        }

        Optional<AiMove> move = new OpponentHeuristic(hydrator, new Random(3)).chooseMove(state, "alice", AiDifficulty.EASY);

        assertEquals(pos(1, 2), move.orElseThrow().position());
    }

    @Test
    void testUnresolvableCardsAreSkipped() {
        hydrator.add(card("late", "alice", 3, 3, 3, 3));
        state.getPlayer1().setHand(new ArrayList<>(List.of("ghost", "late")));

        List<AiMove> candidates = new OpponentHeuristic(hydrator, new Random(5)).scoreCandidates(state, "alice");

        assertEquals(16, candidates.size());
        assertTrue(candidates.stream().allMatch(m -> m.cardInstanceId().equals("late")));
    }

    @Test
    void testPositionalBonus() {
        assertEquals(50, OpponentHeuristic.positionalBonus(pos(0, 0), 4));
        assertEquals(50, OpponentHeuristic.positionalBonus(pos(3, 3), 4));
        assertEquals(30, OpponentHeuristic.positionalBonus(pos(1, 1), 4));
        assertEquals(30, OpponentHeuristic.positionalBonus(pos(2, 1), 4));
        assertEquals(0, OpponentHeuristic.positionalBonus(pos(0, 1), 4));
        assertEquals(0, OpponentHeuristic.positionalBonus(pos(3, 2), 4));
    }
}
