package com.example.cardclash.logic;

import com.example.cardclash.common.IllegalMoveException;
import com.example.cardclash.config.CardClashProperties;
import com.example.cardclash.logic.ability.AbilityRegistry;
import com.example.cardclash.model.domain.Board;
import com.example.cardclash.model.domain.BoardCell;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.CellState;
import com.example.cardclash.model.domain.EventType;
import com.example.cardclash.model.domain.GameEvent;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.GameStatus;
import com.example.cardclash.model.domain.InGameCard;
import com.example.cardclash.model.domain.MoveResult;
import com.example.cardclash.model.domain.PlayerState;
import com.example.cardclash.model.domain.TemporaryEffect;
import com.example.cardclash.model.domain.TerminationReason;
import com.example.cardclash.model.domain.TileEffect;
import com.example.cardclash.model.domain.TileStatus;
import com.example.cardclash.model.domain.TriggerMoment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Rules of the card battle as pure state transitions.
 * <p>
 * Every operation validates against the state it is given, works on a copy and returns the new
 * state with the events produced. The input state is never modified, so a rejected move or a
 * failed save leaves the previous state intact.
 */
@Slf4j
@Component
public class GameEngine {

    private final CardInstanceHydrator hydrator;
    private final AbilityRegistry abilityRegistry;
    private final Random random;
    private final int boardSize;
    private final int maxHandSize;
    private final int initialHandSize;

    @Autowired
    public GameEngine(CardInstanceHydrator hydrator, AbilityRegistry abilityRegistry, CardClashProperties properties) {
        this(hydrator, abilityRegistry, properties, new Random());
    }

    public GameEngine(CardInstanceHydrator hydrator, AbilityRegistry abilityRegistry,
                      CardClashProperties properties, Random random) {
        this.hydrator = hydrator;
        this.abilityRegistry = abilityRegistry;
        this.random = random;
        this.boardSize = properties.getEngine().getBoardSize();
        this.maxHandSize = properties.getEngine().getMaxHandSize();
        this.initialHandSize = properties.getEngine().getInitialHandSize();
    }

    // --- Setup ---

    public GameState initializeGame(List<String> player1Cards, List<String> player2Cards,
                                    String player1Id, String player2Id) {
        if (player1Id == null || player2Id == null || player1Id.equals(player2Id)) {
            throw new IllegalArgumentException("A match needs two distinct players");
        }
        GameState state = new GameState();
        state.setBoard(new Board(boardSize));
        state.setPlayer1(deal(player1Id, player1Cards));
        state.setPlayer2(deal(player2Id, player2Cards));
        state.setCurrentPlayerId(player1Id);
        state.setTurnNumber(1);
        state.setStatus(GameStatus.ACTIVE);
        state.setMaxHandSize(maxHandSize);

        hydrateHand(state, state.getPlayer1());
        hydrateHand(state, state.getPlayer2());
        log.debug("Initialized game {} vs {}", player1Id, player2Id);
        return state;
    }

    private PlayerState deal(String userId, List<String> cards) {
        List<String> deck = new ArrayList<>(cards);
        Collections.shuffle(deck, random);
        int handSize = Math.min(initialHandSize, deck.size());
        List<String> hand = new ArrayList<>(deck.subList(0, handSize));
        List<String> rest = new ArrayList<>(deck.subList(handSize, deck.size()));
        return new PlayerState(userId, hand, rest);
    }

    // --- Actions ---

    public MoveResult placeCard(GameState state, String playerId, String cardInstanceId, BoardPosition position) {
        requireTurn(state, playerId);
        Board board = state.getBoard();
        if (!board.contains(position)) {
            throw new IllegalMoveException("Position " + position + " is outside the board");
        }
        BoardCell target = board.cellAt(position);
        if (target.isOccupied()) {
            throw new IllegalMoveException("Cell " + position + " is already occupied");
        }
        if (target.isBlocked()) {
            throw new IllegalMoveException("Cell " + position + " is blocked");
        }
        if (cardInstanceId == null || !state.player(playerId).getHand().contains(cardInstanceId)) {
            throw new IllegalMoveException("Card " + cardInstanceId + " is not in your hand");
        }

        GameState next = state.copy();
        List<GameEvent> events = new ArrayList<>();

        InGameCard card = hydrate(next, cardInstanceId, playerId);
        next.player(playerId).getHand().remove(cardInstanceId);
        BoardCell cell = next.getBoard().cellAt(position);
        cell.place(playerId, card);
        events.add(GameEvent.of(EventType.CARD_PLACED, playerId, cardInstanceId, position));
        applyTileToPlacedCard(cell, position, playerId, events);

        next = abilityRegistry.fire(TriggerMoment.ON_PLACE, next, List.of(position), playerId, events);
        hydrateHands(next);

        if (next.isActive()) {
            next = resolveCombat(next, position, playerId, events);
        }
        next.recomputeScores();

        if (next.isActive()) {
            drawIfRoom(next, next.player(playerId), events);
            if (next.getBoard().isFull()) {
                finishOnFullBoard(next, events);
            } else {
                next = advanceTurn(next, events);
            }
        }
        next.recomputeScores();
        log.debug("Player {} placed {} at {} ({} events)", playerId, cardInstanceId, position, events.size());
        return new MoveResult(next, events);
    }

    /**
     * Passes the turn without placing a card.
     */
    public MoveResult endTurn(GameState state, String playerId) {
        requireTurn(state, playerId);
        GameState next = state.copy();
        List<GameEvent> events = new ArrayList<>();
        next = advanceTurn(next, events);
        next.recomputeScores();
        return new MoveResult(next, events);
    }

    public GameState surrender(GameState state, String playerId) {
        return concede(state, playerId, TerminationReason.SURRENDER);
    }

    /**
     * Ends the match against a player who left and did not come back.
     */
    public GameState forfeit(GameState state, String playerId) {
        return concede(state, playerId, TerminationReason.DISCONNECT);
    }

    /**
     * Ends a match that never got under way. Nobody wins.
     */
    public GameState abort(GameState state) {
        requireActive(state);
        GameState next = state.copy();
        next.setStatus(GameStatus.ABORTED);
        next.setWinnerId(null);
        next.setTerminationReason(TerminationReason.ABORTED);
        return next;
    }

    private GameState concede(GameState state, String loserId, TerminationReason reason) {
        requireActive(state);
        if (!state.isParticipant(loserId)) {
            throw new IllegalMoveException("Player " + loserId + " is not part of this match");
        }
        GameState next = state.copy();
        String winnerId = next.opponentOf(loserId).getUserId();
        next.setStatus(winnerId.equals(next.getPlayer1().getUserId()) ? GameStatus.PLAYER1_WIN : GameStatus.PLAYER2_WIN);
        next.setWinnerId(winnerId);
        next.setTerminationReason(reason);
        return next;
    }

    // --- Combat ---

    private GameState resolveCombat(GameState state, BoardPosition position, String playerId, List<GameEvent> events) {
        BoardCell placed = state.getBoard().cellAt(position);
        // All four comparisons use the board as it stood before any flip
        List<BoardPosition> captured = new ArrayList<>(
                CombatResolver.captures(state.getBoard(), position, placed.getPower(), playerId));
        captured.sort(BoardPosition.SCAN_ORDER);

        GameState current = state;
        for (BoardPosition target : captured) {
            if (!current.isActive()) {
                break;
            }
            current = abilityRegistry.fire(TriggerMoment.ON_FLIP, current, List.of(position), playerId, target, events);
            BoardCell cell = current.getBoard().cellAt(target);
            // an OnFlip ability may have protected or already taken the cell
            if (!cell.isOccupied() || playerId.equals(cell.getOwnerId()) || cell.isImmune()) {
                continue;
            }
            cell.setOwnerId(playerId);
            events.add(GameEvent.of(EventType.CARD_FLIPPED, playerId, cell.getCardInstanceId(), target,
                    placed.getCardInstanceId()));
            current = abilityRegistry.fire(TriggerMoment.ON_FLIPPED, current, List.of(target), playerId, position, events);
        }
        hydrateHands(current);
        return current;
    }

    private void applyTileToPlacedCard(BoardCell cell, BoardPosition position, String playerId, List<GameEvent> events) {
        TileEffect tile = cell.getTileEffect();
        if (tile == null || tile.status() == TileStatus.BLOCKED) {
            return;
        }
        if (tile.status() == TileStatus.CURSED) {
            cell.setPower(cell.getPower().shift(-tile.magnitude()));
            cell.setState(CellState.DEBUFFED);
        } else {
            cell.setPower(cell.getPower().shift(tile.magnitude()));
            cell.setState(CellState.BUFFED);
        }
        cell.setTileEffect(null);
        events.add(GameEvent.of(EventType.TILE_EFFECT_APPLIED, playerId, cell.getCardInstanceId(), position,
                tile.status().name()));
    }

    // --- Turn flow ---

    private GameState advanceTurn(GameState state, List<GameEvent> events) {
        String ending = state.getCurrentPlayerId();
        // decay first: effects applied by OnTurnEnd last into the opponent's turn
        decayEffects(state, events);
        GameState next = abilityRegistry.fire(TriggerMoment.ON_TURN_END, state, ownedBy(state, ending), ending, events);
        if (!next.isActive()) {
            return next;
        }

        String upcoming = next.opponentOf(ending).getUserId();
        next.setCurrentPlayerId(upcoming);
        events.add(GameEvent.of(EventType.TURN_ENDED, ending, null, null, upcoming));

        // a round is two turns
        if (next.getTurnNumber() % 2 == 0) {
            next = abilityRegistry.fire(TriggerMoment.ON_ROUND_END, next, next.getBoard().occupiedPositions(),
                    ending, events);
            if (!next.isActive()) {
                return next;
            }
            next = abilityRegistry.fire(TriggerMoment.ON_ROUND_START, next, next.getBoard().occupiedPositions(),
                    upcoming, events);
            if (!next.isActive()) {
                return next;
            }
        }
        next.setTurnNumber(next.getTurnNumber() + 1);

        next = abilityRegistry.fire(TriggerMoment.ON_TURN_START, next, ownedBy(next, upcoming), upcoming, events);
        hydrateHands(next);
        return next;
    }

    private List<BoardPosition> ownedBy(GameState state, String playerId) {
        Board board = state.getBoard();
        return board.occupiedPositions().stream()
                .filter(p -> playerId.equals(board.cellAt(p).getOwnerId()))
                .toList();
    }

    /**
     * Counts down tile effects, temporary power changes and timed cell states by one turn.
     */
    private void decayEffects(GameState state, List<GameEvent> events) {
        Board board = state.getBoard();
        for (BoardPosition position : board.positions()) {
            BoardCell cell = board.cellAt(position);

            if (cell.getTileEffect() != null) {
                TileEffect ticked = cell.getTileEffect().tick();
                if (ticked.expired()) {
                    cell.setTileEffect(null);
                    events.add(GameEvent.of(EventType.TILE_RESET, ticked.appliedBy(), null, position));
                } else {
                    cell.setTileEffect(ticked);
                }
            }
            if (!cell.isOccupied()) {
                continue;
            }

            boolean reverted = false;
            List<TemporaryEffect> remaining = new ArrayList<>();
            for (TemporaryEffect effect : cell.getTemporaryEffects()) {
                TemporaryEffect ticked = effect.tick();
                if (ticked.turnsLeft() <= 0) {
                    cell.setPower(cell.getPower().revert(ticked.delta()));
                    reverted = true;
                } else {
                    remaining.add(ticked);
                }
            }
            cell.setTemporaryEffects(remaining);

            if (cell.getStateTurnsLeft() > 0) {
                cell.setStateTurnsLeft(cell.getStateTurnsLeft() - 1);
                if (cell.getStateTurnsLeft() == 0) {
                    cell.setState(CellState.NORMAL);
                    reverted = true;
                }
            }
            if (reverted) {
                if (cell.getState() != CellState.IMMUNE && remaining.isEmpty()) {
                    cell.setState(CellState.NORMAL);
                }
                events.add(GameEvent.of(EventType.POWER_CHANGED, cell.getOwnerId(), cell.getCardInstanceId(),
                        position, "expired"));
            }
        }
    }

    private void drawIfRoom(GameState state, PlayerState player, List<GameEvent> events) {
        if (player.getHand().size() >= state.getMaxHandSize() || player.getDeck().isEmpty()) {
            return;
        }
        String drawn = player.getDeck().remove(0);
        hydrate(state, drawn, player.getUserId());
        player.getHand().add(drawn);
        events.add(GameEvent.of(EventType.CARD_DRAWN, player.getUserId(), drawn, null));
    }

    private void finishOnFullBoard(GameState state, List<GameEvent> events) {
        state.recomputeScores();
        int p1 = state.getPlayer1().getScore();
        int p2 = state.getPlayer2().getScore();
        if (p1 > p2) {
            state.setStatus(GameStatus.PLAYER1_WIN);
            state.setWinnerId(state.getPlayer1().getUserId());
        } else if (p2 > p1) {
            state.setStatus(GameStatus.PLAYER2_WIN);
            state.setWinnerId(state.getPlayer2().getUserId());
        } else {
            state.setStatus(GameStatus.DRAW);
            state.setWinnerId(null);
        }
        state.setTerminationReason(TerminationReason.COMPLETED);
        events.add(GameEvent.of(EventType.GAME_OVER, state.getWinnerId(), null, null, p1 + "-" + p2));
    }

    // --- Hydration ---

    private InGameCard hydrate(GameState state, String cardInstanceId, String ownerId) {
        InGameCard cached = state.getCards().get(cardInstanceId);
        if (cached != null) {
            return cached;
        }
        InGameCard card = hydrator.resolve(cardInstanceId, ownerId);
        state.getCards().put(cardInstanceId, card);
        return card;
    }

    private void hydrateHand(GameState state, PlayerState player) {
        for (String id : player.getHand()) {
            hydrate(state, id, player.getUserId());
        }
    }

    // Abilities may move cards into hands without resolving them
    private void hydrateHands(GameState state) {
        hydrateHand(state, state.getPlayer1());
        hydrateHand(state, state.getPlayer2());
    }

    // --- Validation ---

    private void requireActive(GameState state) {
        if (!state.isActive()) {
            throw new IllegalMoveException("Match is not active");
        }
    }

    private void requireTurn(GameState state, String playerId) {
        requireActive(state);
        if (!state.isParticipant(playerId)) {
            throw new IllegalMoveException("Player " + playerId + " is not part of this match");
        }
        if (!playerId.equals(state.getCurrentPlayerId())) {
            throw new IllegalMoveException("It is not your turn");
        }
    }
}
