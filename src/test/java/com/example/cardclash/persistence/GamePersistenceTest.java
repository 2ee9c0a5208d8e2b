package com.example.cardclash.persistence;

import com.example.cardclash.model.domain.AbilityDescriptor;
import com.example.cardclash.model.domain.EffectKind;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.GameStatus;
import com.example.cardclash.model.domain.TargetScope;
import com.example.cardclash.model.domain.TriggerMoment;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GamePersistenceTest {

    @Test
    public void testLenientDeserialization() throws Exception {
        // 1. Same leniency as the persistence service
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        // 2. A stored state carrying fields this version does not know
        String jsonWithExtraField = "{" +
                "\"schemaVersion\": 1," +
                "\"matchId\": \"test-match-id\"," +
                "\"turnNumber\": 3," +
                "\"status\": \"active\"," +
                "\"unknownField\": \"this should be ignored\"," +
                "\"anotherUnknown\": 123" +
                "}";

        GameState state = objectMapper.readValue(jsonWithExtraField, GameState.class);

        assertNotNull(state);
        assertEquals("test-match-id", state.getMatchId());
        assertEquals(3, state.getTurnNumber());
        assertEquals(GameStatus.ACTIVE, state.getStatus());
        assertEquals(1, state.getSchemaVersion());
    }

    @Test
    public void testSchemaVersionDefault() {
        GameState state = new GameState();
        assertEquals(1, state.getSchemaVersion(), "Default schema version should be 1");
    }

    @Test
    public void testAbilityWithUnlistedTriggerMomentReads() throws Exception {
        String json = "{\"name\":\"Bulwark\",\"triggers\":[\"OnPlace\",\"OnDefend\"]," +
                "\"effect\":{\"kind\":\"POWER_CHANGE\",\"magnitude\":2,\"target\":\"ADJACENT_ALLIES\"}}";

        AbilityDescriptor ability = new ObjectMapper().readValue(json, AbilityDescriptor.class);

        assertTrue(ability.firesOn(TriggerMoment.ON_PLACE));
        assertTrue(ability.firesOn(TriggerMoment.of("OnDefend")));
        assertFalse(ability.firesOn(TriggerMoment.ON_FLIP));
        assertEquals(EffectKind.POWER_CHANGE, ability.effect().kind());
        assertEquals(TargetScope.ADJACENT_ALLIES, ability.effect().target());
    }
}
