package com.webchat.chatbackend.realtime.ws;

import com.webchat.chatbackend.realtime.SessionBridge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ChatWebSocketHandlerTest {

    private SessionBridge sessionBridge;
    private ChatWebSocketHandler handler;
    private WebSocketSession session;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        sessionBridge = mock(SessionBridge.class);
        handler = new ChatWebSocketHandler(sessionBridge, 1000);
        session = mock(WebSocketSession.class);
        attributes = new HashMap<>();
        when(session.getId()).thenReturn("s-1");
        when(session.getAttributes()).thenReturn(attributes);
        when(session.isOpen()).thenReturn(true);
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/ws/chat?token=abc.def.ghi"));
    }

    @Test
    void extractsTokenFromQuery() {
        assertEquals("abc.def.ghi", ChatWebSocketHandler.extractToken(URI.create("ws://h/ws/chat?token=abc.def.ghi&x=1")));
        assertNull(ChatWebSocketHandler.extractToken(URI.create("ws://h/ws/chat")));
        assertNull(ChatWebSocketHandler.extractToken(null));
    }

    @Test
    void connectionIsHandedToTheBridgeWithItsToken() {
        handler.afterConnectionEstablished(session);

        Object handle = attributes.get(ChatWebSocketHandler.HANDLE_ATTRIBUTE);
        assertInstanceOf(WebSocketConnectionHandle.class, handle);
        verify(sessionBridge).connect(eq("abc.def.ghi"), any(WebSocketConnectionHandle.class));
    }

    @Test
    void closeAndTransportErrorReleaseTheHandle() {
        handler.afterConnectionEstablished(session);
        WebSocketConnectionHandle handle = (WebSocketConnectionHandle) attributes.get(ChatWebSocketHandler.HANDLE_ATTRIBUTE);

        handler.handleTransportError(session, new IOException("reset"));
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(sessionBridge, times(2)).close(handle);
    }

    @Test
    void inboundFramesAreIgnored() throws Exception {
        handler.afterConnectionEstablished(session);
        clearInvocations(sessionBridge);

        handler.handleMessage(session, new TextMessage("{\"type\":\"send\",\"text\":\"hi\"}"));

        verifyNoInteractions(sessionBridge);
        verify(session, never()).sendMessage(any());
    }

    @Test
    void handleWritesTextFramesAndRefusesClosedSessions() throws Exception {
        WebSocketConnectionHandle handle = new WebSocketConnectionHandle(session, 1000);

        handle.send("{\"type\":\"message\"}");
        verify(session).sendMessage(new TextMessage("{\"type\":\"message\"}"));

        when(session.isOpen()).thenReturn(false);
        assertThrows(IOException.class, () -> handle.send("late"));
        assertFalse(handle.isOpen());
    }

    @Test
    void handleCloseIsForwardedOnlyWhileOpen() throws Exception {
        WebSocketConnectionHandle handle = new WebSocketConnectionHandle(session, 1000);

        handle.close(CloseStatus.POLICY_VIOLATION);
        verify(session).close(CloseStatus.POLICY_VIOLATION);

        when(session.isOpen()).thenReturn(false);
        handle.close(CloseStatus.NORMAL);
        verify(session, never()).close(CloseStatus.NORMAL);
    }
}
