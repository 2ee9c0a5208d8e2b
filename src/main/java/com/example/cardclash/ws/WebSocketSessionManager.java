package com.example.cardclash.ws;

import com.example.cardclash.service.MatchSessionService;
import com.example.cardclash.service.MatchmakingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * Listens to STOMP connection events. A dropped connection opens the grace window of the match
 * the user is playing and takes the user out of the matchmaking queue.
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    private final MatchSessionService matchSessionService;
    private final MatchmakingService matchmakingService;

    public WebSocketSessionManager(MatchSessionService matchSessionService, MatchmakingService matchmakingService) {
        this.matchSessionService = matchSessionService;
        this.matchmakingService = matchmakingService;
    }

    @EventListener
    public void handleSessionConnected(SessionConnectedEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        Principal principal = event.getUser();
        log.debug("WebSocket session {} connected for {}", accessor.getSessionId(),
                principal == null ? "anonymous" : principal.getName());
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        Principal principal = event.getUser();
        String sessionId = event.getSessionId();
        if (principal == null || sessionId == null) {
            log.debug("Ignoring disconnect without user or session id: session={}", sessionId);
            return;
        }
        String userId = principal.getName();
        log.info("WebSocket session {} of {} closed ({})", sessionId, userId, event.getCloseStatus());

        matchSessionService.onDisconnect(userId, sessionId);
        matchmakingService.leave(userId);
    }
}
