package com.example.cardclash.controller;

import com.example.cardclash.common.GamePersistenceException;
import com.example.cardclash.common.IllegalMoveException;
import com.example.cardclash.model.domain.BoardPosition;
import com.example.cardclash.model.dto.ActionRequest;
import com.example.cardclash.model.dto.ActionType;
import com.example.cardclash.service.MatchSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.security.authentication.TestingAuthenticationToken;

import java.security.Principal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class GameSocketControllerTest {

    @Mock
    private MatchSessionService matchSessionService;

    private GameSocketController controller;
    private final Principal alice = new TestingAuthenticationToken("alice", null);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        controller = new GameSocketController(matchSessionService);
    }

    @Test
    void testJoinPassesTheStompSession() {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create();
        headers.setSessionId("s1");

        controller.join("match-1", alice, headers);

        verify(matchSessionService).join("match-1", "alice", "s1");
    }

    @Test
    void testActionIsForwardedForTheAuthenticatedUser() {
        ActionRequest request = new ActionRequest("match-1", ActionType.PLACE_CARD, "a1", new BoardPosition(1, 1));

        controller.action("match-1", request, alice);

        verify(matchSessionService).action("match-1", "alice", request);
    }

    @Test
    void testUnauthenticatedMessagesAreRejected() {
        assertThrows(IllegalStateException.class, () -> controller.action("match-1", new ActionRequest(), null));
        verifyNoInteractions(matchSessionService);
    }

    @Test
    void testErrorReplies() {
        assertEquals("It is not your turn",
                controller.handleRejected(new IllegalMoveException("It is not your turn")).getMessage());
        assertEquals("Could not save the game, please retry",
                controller.handlePersistenceFailure(new GamePersistenceException("db down", null)).getMessage());
    }

    @Test
    void testAnimationsCompleteIsAcknowledged() {
        controller.animationsComplete("match-1", alice);

        verify(matchSessionService).animationsComplete("match-1", "alice");
        verify(matchSessionService, never()).action(any(), any(), any());
    }
}
