package com.webchat.chatbackend.realtime.ws;

import com.webchat.chatbackend.realtime.SessionBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Transport adapter for {@code /ws/chat?token=...}. Inbound frames only keep
 * the connection alive; domain commands arrive over HTTP.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String HANDLE_ATTRIBUTE = "webchat.connectionHandle";

    private final SessionBridge sessionBridge;
    private final long sendTimeoutMs;

    public ChatWebSocketHandler(SessionBridge sessionBridge,
                                @Value("${webchat.realtime.send-timeout-ms:5000}") long sendTimeoutMs) {
        this.sessionBridge = sessionBridge;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketConnectionHandle handle = new WebSocketConnectionHandle(session, sendTimeoutMs);
        session.getAttributes().put(HANDLE_ATTRIBUTE, handle);
        sessionBridge.connect(extractToken(session.getUri()), handle);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.trace("Ignoring inbound frame on {} ({} chars)", session.getId(), message.getPayloadLength());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
        closeHandle(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Socket {} closed with {}", session.getId(), status);
        closeHandle(session);
    }

    private void closeHandle(WebSocketSession session) {
        Object handle = session.getAttributes().get(HANDLE_ATTRIBUTE);
        if (handle instanceof WebSocketConnectionHandle connectionHandle) {
            sessionBridge.close(connectionHandle);
        }
    }

    static String extractToken(URI uri) {
        if (uri == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
    }
}
