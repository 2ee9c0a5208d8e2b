package com.example.cardclash.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

/**
 * Targets single STOMP sessions rather than every session of a user. Used to tell a replaced
 * connection why it is going away and then close it.
 */
@Slf4j
@Component
public class WebSocketDisconnectHelper {

    private final SimpMessagingTemplate messagingTemplate;
    private final MessageChannel clientInboundChannel;

    public WebSocketDisconnectHelper(SimpMessagingTemplate messagingTemplate,
                                     @Qualifier("clientInboundChannel") MessageChannel clientInboundChannel) {
        this.messagingTemplate = messagingTemplate;
        this.clientInboundChannel = clientInboundChannel;
    }

    public void sendToSession(String userId, String sessionId, String destination, Object payload) {
        try {
            SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
            headerAccessor.setSessionId(sessionId);
            headerAccessor.setLeaveMutable(true);
            messagingTemplate.convertAndSendToUser(userId, destination, payload, headerAccessor.getMessageHeaders());
        } catch (Exception e) {
            log.warn("Could not notify session {} of user {}", sessionId, userId, e);
        }
    }

    public void forceDisconnect(String sessionId) {
        try {
            StompHeaderAccessor header = StompHeaderAccessor.create(StompCommand.DISCONNECT);
            header.setSessionId(sessionId);
            header.setLeaveMutable(true);
            clientInboundChannel.send(MessageBuilder.createMessage(new byte[0], header.getMessageHeaders()));
        } catch (Exception e) {
            log.warn("Could not force disconnect of session {}", sessionId, e);
        }
    }
}
