package com.example.cardclash.controller;

import com.example.cardclash.common.CardNotFoundException;
import com.example.cardclash.common.GamePersistenceException;
import com.example.cardclash.common.MatchNotFoundException;
import com.example.cardclash.model.dto.ActionRequest;
import com.example.cardclash.model.dto.ErrorPayload;
import com.example.cardclash.service.MatchSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * Real-time match channel. Replies go to {@code /user/queue/match}; anything rejected is
 * answered on {@code /user/queue/errors} of the sending session only.
 */
@Slf4j
@Controller
public class GameSocketController {

    static final String ERRORS_DESTINATION = "/queue/errors";

    private final MatchSessionService matchSessionService;

    public GameSocketController(MatchSessionService matchSessionService) {
        this.matchSessionService = matchSessionService;
    }

    /**
     * Client sends to: /app/match/{matchId}/join
     */
    @MessageMapping("/match/{matchId}/join")
    public void join(@DestinationVariable String matchId, Principal principal, SimpMessageHeaderAccessor headers) {
        matchSessionService.join(matchId, requireUser(principal), headers.getSessionId());
    }

    /**
     * Client sends to: /app/match/{matchId}/action
     */
    @MessageMapping("/match/{matchId}/action")
    public void action(@DestinationVariable String matchId, @Payload ActionRequest request, Principal principal) {
        matchSessionService.action(matchId, requireUser(principal), request);
    }

    /**
     * Client sends to: /app/match/{matchId}/animations-complete
     */
    @MessageMapping("/match/{matchId}/animations-complete")
    public void animationsComplete(@DestinationVariable String matchId, Principal principal) {
        matchSessionService.animationsComplete(matchId, requireUser(principal));
    }

    @MessageExceptionHandler(GamePersistenceException.class)
    @SendToUser(destinations = ERRORS_DESTINATION, broadcast = false)
    public ErrorPayload handlePersistenceFailure(GamePersistenceException e) {
        log.error("Action not applied, state could not be saved", e);
        return new ErrorPayload("Could not save the game, please retry");
    }

    @MessageExceptionHandler({IllegalStateException.class, IllegalArgumentException.class,
            MatchNotFoundException.class, CardNotFoundException.class})
    @SendToUser(destinations = ERRORS_DESTINATION, broadcast = false)
    public ErrorPayload handleRejected(RuntimeException e) {
        log.debug("Rejected client message: {}", e.getMessage());
        return new ErrorPayload(e.getMessage());
    }

    private static String requireUser(Principal principal) {
        if (principal == null) {
            throw new IllegalStateException("Not authenticated");
        }
        return principal.getName();
    }
}
