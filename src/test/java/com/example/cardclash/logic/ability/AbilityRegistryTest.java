package com.example.cardclash.logic.ability;

import com.example.cardclash.logic.GameEngine;
import com.example.cardclash.logic.TestCards;
import com.example.cardclash.model.domain.AbilityDescriptor;
import com.example.cardclash.model.domain.AbilityEffect;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.domain.CellState;
import com.example.cardclash.model.domain.EffectCondition;
import com.example.cardclash.model.domain.EffectKind;
import com.example.cardclash.model.domain.EventType;
import com.example.cardclash.model.domain.GameEvent;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.GameStatus;
import com.example.cardclash.model.domain.MoveResult;
import com.example.cardclash.model.domain.Power;
import com.example.cardclash.model.domain.TargetScope;
import com.example.cardclash.model.domain.TileStatus;
import com.example.cardclash.model.domain.TriggerMoment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static com.example.cardclash.logic.TestCards.card;
import static com.example.cardclash.logic.TestCards.giveHand;
import static com.example.cardclash.logic.TestCards.put;
import static org.junit.jupiter.api.Assertions.*;

class AbilityRegistryTest {

    private AbilityRegistry registry;
    private GameEngine gameEngine;
    private GameState state;

    @BeforeEach
    void setUp() {
        TestCards.MapHydrator hydrator = new TestCards.MapHydrator();
        List<String> aliceDeck = hydrator.addDeck("a", "alice", 12, 2);
        List<String> bobDeck = hydrator.addDeck("b", "bob", 12, 2);
        registry = new AbilityRegistry();
        gameEngine = TestCards.engine(hydrator, registry);
        state = gameEngine.initializeGame(aliceDeck, bobDeck, "alice", "bob");
    }

    private static BoardPosition pos(int x, int y) {
        return new BoardPosition(x, y);
    }

    private static AbilityDescriptor ability(String name, TriggerMoment moment, EffectKind kind,
                                             EffectCondition condition, int magnitude, int duration,
                                             TargetScope target) {
        return new AbilityDescriptor(name, Set.of(moment), new AbilityEffect(kind, condition, magnitude, duration, target));
    }

    private static Power flat(int value) {
        return new Power(value, value, value, value);
    }

    @Test
    void testOnPlaceBuffAppliesBeforeCombat() {
        AbilityDescriptor rally = ability("Rally", TriggerMoment.ON_PLACE, EffectKind.POWER_CHANGE,
                EffectCondition.ALWAYS, 2, 0, TargetScope.SELF);
        giveHand(state, "alice", card("rally", "alice", flat(3), rally));
        put(state, pos(1, 0), "bob", card("def", "bob", 1, 1, 4, 1));

        MoveResult result = gameEngine.placeCard(state, "alice", "rally", pos(1, 1));

        assertEquals(flat(5), result.state().getBoard().cellAt(pos(1, 1)).getPower());
        assertEquals("alice", result.state().getBoard().cellAt(pos(1, 0)).getOwnerId());
        assertTrue(result.events().stream().anyMatch(e -> e.type() == EventType.ABILITY_TRIGGERED
                && "Rally@OnPlace".equals(e.detail())));
    }

    @Test
    void testTemporaryBuffWearsOffAfterItsDuration() {
        AbilityDescriptor surge = ability("Surge", TriggerMoment.ON_PLACE, EffectKind.POWER_CHANGE,
                EffectCondition.ALWAYS, 2, 2, TargetScope.SELF);
        giveHand(state, "alice", card("surge", "alice", flat(3), surge));

        GameState afterPlace = gameEngine.placeCard(state, "alice", "surge", pos(0, 0)).state();
        assertEquals(flat(5), afterPlace.getBoard().cellAt(pos(0, 0)).getPower());
        assertEquals(CellState.BUFFED, afterPlace.getBoard().cellAt(pos(0, 0)).getState());

        MoveResult afterBob = gameEngine.endTurn(afterPlace, "bob");
        assertEquals(flat(3), afterBob.state().getBoard().cellAt(pos(0, 0)).getPower());
        assertEquals(CellState.NORMAL, afterBob.state().getBoard().cellAt(pos(0, 0)).getState());
        assertTrue(afterBob.state().getBoard().cellAt(pos(0, 0)).getTemporaryEffects().isEmpty());
    }

    @Test
    void testExpiringBuffDoesNotPushADebuffedCardBelowZero() {
        AbilityDescriptor surge = ability("Surge", TriggerMoment.ON_PLACE, EffectKind.POWER_CHANGE,
                EffectCondition.ALWAYS, 3, 2, TargetScope.SELF);
        AbilityDescriptor wither = ability("Wither", TriggerMoment.ON_PLACE, EffectKind.POWER_CHANGE,
                EffectCondition.ALWAYS, -10, 0, TargetScope.ADJACENT_ENEMIES);
        giveHand(state, "alice", card("surge", "alice", flat(1), surge));
        giveHand(state, "bob", card("wither", "bob", flat(0), wither));

        GameState afterAlice = gameEngine.placeCard(state, "alice", "surge", pos(0, 0)).state();
        assertEquals(flat(4), afterAlice.getBoard().cellAt(pos(0, 0)).getPower());

        GameState afterBob = gameEngine.placeCard(afterAlice, "bob", "wither", pos(1, 0)).state();

        assertEquals("alice", afterBob.getBoard().cellAt(pos(0, 0)).getOwnerId());
        assertEquals(flat(0), afterBob.getBoard().cellAt(pos(0, 0)).getPower());
        assertTrue(afterBob.getBoard().cellAt(pos(0, 0)).getTemporaryEffects().isEmpty());
    }

    @Test
    void testTileMarkedAtTurnEndLastsThroughTheOpponentsTurn() {
        AbilityDescriptor hex = ability("Hex", TriggerMoment.ON_TURN_END, EffectKind.CURSE_TILES,
                EffectCondition.ALWAYS, 2, 1, TargetScope.ADJACENT_EMPTY);
        put(state, pos(0, 0), "alice", card("hex", "alice", flat(1), hex));

        MoveResult afterAlice = gameEngine.endTurn(state, "alice");

        assertEquals("bob", afterAlice.state().getCurrentPlayerId());
        assertEquals(TileStatus.CURSED, afterAlice.state().getBoard().cellAt(pos(1, 0)).getTileEffect().status());
        assertEquals(TileStatus.CURSED, afterAlice.state().getBoard().cellAt(pos(0, 1)).getTileEffect().status());
        assertTrue(afterAlice.events().stream().noneMatch(e -> e.type() == EventType.TILE_RESET));

        MoveResult afterBob = gameEngine.endTurn(afterAlice.state(), "bob");

        assertNull(afterBob.state().getBoard().cellAt(pos(1, 0)).getTileEffect());
        assertTrue(afterBob.events().stream().anyMatch(e -> e.type() == EventType.TILE_RESET));
    }

    @Test
    void testRoundAbilitiesFireAfterEverySecondTurn() {
        AbilityDescriptor tide = ability("Tide", TriggerMoment.ON_ROUND_END, EffectKind.POWER_CHANGE,
                EffectCondition.ALWAYS, 1, 0, TargetScope.SELF);
        put(state, pos(3, 3), "bob", card("tide", "bob", flat(2), tide));

        MoveResult afterAlice = gameEngine.endTurn(state, "alice");
        assertEquals(flat(2), afterAlice.state().getBoard().cellAt(pos(3, 3)).getPower());

        MoveResult afterBob = gameEngine.endTurn(afterAlice.state(), "bob");

        assertEquals(flat(3), afterBob.state().getBoard().cellAt(pos(3, 3)).getPower());
        assertEquals(3, afterBob.state().getTurnNumber());
        assertTrue(afterBob.events().stream().anyMatch(e -> e.type() == EventType.ABILITY_TRIGGERED
                && "Tide@OnRoundEnd".equals(e.detail())));
    }

    @Test
    void testBuffOnAdjacentAllies() {
        AbilityDescriptor banner = ability("Banner", TriggerMoment.ON_PLACE, EffectKind.POWER_CHANGE,
                EffectCondition.ALWAYS, 1, 0, TargetScope.ADJACENT_ALLIES);
        put(state, pos(0, 0), "alice", card("ally", "alice", 1, 1, 1, 1));
        put(state, pos(2, 0), "bob", card("foe", "bob", 1, 1, 1, 9));
        giveHand(state, "alice", card("banner", "alice", new Power(1, 1, 1, 1), banner));

        GameState after = gameEngine.placeCard(state, "alice", "banner", pos(1, 0)).state();

        assertEquals(flat(2), after.getBoard().cellAt(pos(0, 0)).getPower());
        assertEquals(new Power(1, 1, 1, 9), after.getBoard().cellAt(pos(2, 0)).getPower());
    }

    @Test
    void testOnFlipRunsBeforeAndOnFlippedAfterTheFlip() {
        AbilityDescriptor scout = ability("Scout", TriggerMoment.ON_FLIP, EffectKind.DRAW_CARD,
                EffectCondition.ALWAYS, 1, 0, TargetScope.SELF);
        AbilityDescriptor grudge = ability("Grudge", TriggerMoment.ON_FLIPPED, EffectKind.POWER_CHANGE,
                EffectCondition.ALWAYS, -1, 0, TargetScope.SELF);
        giveHand(state, "alice", card("scout", "alice", new Power(5, 1, 1, 1), scout));
        put(state, pos(1, 0), "bob", card("grudge", "bob", new Power(3, 3, 1, 3), grudge));

        MoveResult result = gameEngine.placeCard(state, "alice", "scout", pos(1, 1));

        List<GameEvent> events = result.events();
        int onFlip = indexOf(events, e -> e.type() == EventType.ABILITY_TRIGGERED && "Scout@OnFlip".equals(e.detail()));
        int flipped = indexOf(events, e -> e.type() == EventType.CARD_FLIPPED);
        int onFlipped = indexOf(events, e -> e.type() == EventType.ABILITY_TRIGGERED && "Grudge@OnFlipped".equals(e.detail()));
        assertTrue(onFlip >= 0 && onFlip < flipped && flipped < onFlipped, "order was " + events);
        assertEquals(new Power(2, 2, 0, 2), result.state().getBoard().cellAt(pos(1, 0)).getPower());
    }

    @Test
    void testSubjectsFireInBoardScanOrder() {
        AbilityDescriptor ward = ability("Ward", TriggerMoment.ON_TURN_END, EffectKind.GRANT_IMMUNITY,
                EffectCondition.ALWAYS, 0, 1, TargetScope.SELF);
        put(state, pos(1, 1), "alice", card("late", "alice", flat(1), ward));
        put(state, pos(0, 0), "alice", card("early", "alice", flat(1), ward));
        List<GameEvent> events = new ArrayList<>();

        GameState after = registry.fire(TriggerMoment.ON_TURN_END, state, List.of(pos(1, 1), pos(0, 0)), "alice", events);

        List<BoardPosition> fired = events.stream()
                .filter(e -> e.type() == EventType.ABILITY_TRIGGERED)
                .map(GameEvent::position)
                .toList();
        assertEquals(List.of(pos(0, 0), pos(1, 1)), fired);
        assertTrue(after.getBoard().cellAt(pos(0, 0)).isImmune());
        assertFalse(state.getBoard().cellAt(pos(0, 0)).isImmune());
    }

    @Test
    void testFailingHandlerIsSkippedAndItsChangesDiscarded() {
        registry.register(EffectKind.DRAW_CARD, inv -> {
            inv.state().getBoard().cellAt(inv.position()).setOwnerId("bob");
            throw new IllegalStateException("boom");
        });
        AbilityDescriptor broken = ability("Broken", TriggerMoment.ON_TURN_END, EffectKind.DRAW_CARD,
                EffectCondition.ALWAYS, 1, 0, TargetScope.SELF);
        AbilityDescriptor ward = ability("Ward", TriggerMoment.ON_TURN_END, EffectKind.GRANT_IMMUNITY,
                EffectCondition.ALWAYS, 0, 1, TargetScope.SELF);
        put(state, pos(0, 0), "alice", card("broken", "alice", flat(1), broken));
        put(state, pos(1, 1), "alice", card("ward", "alice", flat(1), ward));
        List<GameEvent> events = new ArrayList<>();

        GameState after = registry.fire(TriggerMoment.ON_TURN_END, state, List.of(pos(0, 0), pos(1, 1)), "alice", events);

        assertEquals("alice", after.getBoard().cellAt(pos(0, 0)).getOwnerId());
        assertTrue(after.getBoard().cellAt(pos(1, 1)).isImmune());
        assertTrue(events.stream().noneMatch(e -> "Broken@OnTurnEnd".equals(e.detail())));
    }

    @Test
    void testCustomTriggerMomentNeedsNoEngineChange() {
        TriggerMoment onDefend = TriggerMoment.of("OnDefend");
        AbilityDescriptor bulwark = ability("Bulwark", onDefend, EffectKind.POWER_CHANGE,
                EffectCondition.ALWAYS, 3, 0, TargetScope.SELF);
        put(state, pos(2, 2), "alice", card("bulwark", "alice", flat(1), bulwark));
        List<GameEvent> events = new ArrayList<>();

        GameState untouched = registry.fire(TriggerMoment.ON_TURN_END, state, List.of(pos(2, 2)), "alice", events);
        assertEquals(flat(1), untouched.getBoard().cellAt(pos(2, 2)).getPower());

        GameState after = registry.fire(TriggerMoment.of("OnDefend"), state, List.of(pos(2, 2)), "bob", events);
        assertEquals(flat(4), after.getBoard().cellAt(pos(2, 2)).getPower());
    }

    @Test
    void testConditionIsCheckedBeforeFiring() {
        AbilityDescriptor ambush = ability("Ambush", TriggerMoment.ON_TURN_END, EffectKind.FLIP_TARGETS,
                EffectCondition.ADJACENT_ENEMY_PRESENT, 0, 0, TargetScope.ADJACENT_ENEMIES);
        put(state, pos(0, 0), "alice", card("ambush", "alice", flat(1), ambush));
        List<GameEvent> events = new ArrayList<>();

        registry.fire(TriggerMoment.ON_TURN_END, state, List.of(pos(0, 0)), "alice", events);
        assertTrue(events.isEmpty());

        put(state, pos(1, 0), "bob", card("near", "bob", flat(9), null));
        put(state, pos(0, 1), "bob", card("warded", "bob", flat(9), null));
        state.getBoard().cellAt(pos(0, 1)).setState(CellState.IMMUNE);

        GameState after = registry.fire(TriggerMoment.ON_TURN_END, state, List.of(pos(0, 0)), "alice", events);

        assertEquals("alice", after.getBoard().cellAt(pos(1, 0)).getOwnerId());
        assertEquals("bob", after.getBoard().cellAt(pos(0, 1)).getOwnerId());
    }

    @Test
    void testEndMatchStopsFurtherAbilities() {
        AbilityDescriptor finisher = ability("Finisher", TriggerMoment.ON_TURN_END, EffectKind.END_MATCH,
                EffectCondition.OPPONENT_WIPED_OUT, 0, 0, TargetScope.SELF);
        AbilityDescriptor ward = ability("Ward", TriggerMoment.ON_TURN_END, EffectKind.GRANT_IMMUNITY,
                EffectCondition.ALWAYS, 0, 1, TargetScope.SELF);
        put(state, pos(0, 0), "alice", card("finisher", "alice", flat(1), finisher));
        put(state, pos(3, 3), "alice", card("ward", "alice", flat(1), ward));
        List<GameEvent> events = new ArrayList<>();

        GameState after = registry.fire(TriggerMoment.ON_TURN_END, state, List.of(pos(0, 0), pos(3, 3)), "alice", events);

        assertEquals(GameStatus.PLAYER1_WIN, after.getStatus());
        assertEquals("alice", after.getWinnerId());
        assertFalse(after.getBoard().cellAt(pos(3, 3)).isImmune());
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.GAME_OVER));
    }

    @Test
    void testCurseMarksOnlyEmptyNeighbours() {
        AbilityDescriptor hex = ability("Hex", TriggerMoment.ON_TURN_END, EffectKind.CURSE_TILES,
                EffectCondition.ALWAYS, 2, 0, TargetScope.ADJACENT_EMPTY);
        put(state, pos(1, 1), "alice", card("hex", "alice", flat(1), hex));
        put(state, pos(1, 0), "bob", card("occupant", "bob", flat(1), null));

        GameState after = registry.fire(TriggerMoment.ON_TURN_END, state, List.of(pos(1, 1)), "alice", new ArrayList<>());

        assertNull(after.getBoard().cellAt(pos(1, 0)).getTileEffect());
        for (BoardPosition p : List.of(pos(0, 1), pos(2, 1), pos(1, 2))) {
            assertEquals(TileStatus.CURSED, after.getBoard().cellAt(p).getTileEffect().status());
            assertEquals(2, after.getBoard().cellAt(p).getTileEffect().magnitude());
            assertEquals(1, after.getBoard().cellAt(p).getTileEffect().turnsLeft());
        }
    }

    private static int indexOf(List<GameEvent> events, Predicate<GameEvent> match) {
        for (int i = 0; i < events.size(); i++) {
            if (match.test(events.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
