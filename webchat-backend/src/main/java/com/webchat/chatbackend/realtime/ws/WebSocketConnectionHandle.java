package com.webchat.chatbackend.realtime.ws;

import com.webchat.chatbackend.realtime.AbstractConnectionHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;

import java.io.IOException;

/** Handle over a Spring {@link WebSocketSession}. */
@Slf4j
public class WebSocketConnectionHandle extends AbstractConnectionHandle {

    // Tomcat bounds blocking writes on a session with this user property
    static final String BLOCKING_SEND_TIMEOUT_PROPERTY = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final WebSocketSession session;

    public WebSocketConnectionHandle(WebSocketSession session, long sendTimeoutMs) {
        this.session = session;
        applySendTimeout(sendTimeoutMs);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        synchronized (session) {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Override
    protected boolean isTransportOpen() {
        return session.isOpen();
    }

    @Override
    public void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }

    WebSocketSession session() {
        return session;
    }

    private void applySendTimeout(long sendTimeoutMs) {
        if (sendTimeoutMs <= 0 || !(session instanceof NativeWebSocketSession nativeSession)) {
            return;
        }
        jakarta.websocket.Session standardSession = nativeSession.getNativeSession(jakarta.websocket.Session.class);
        if (standardSession != null) {
            standardSession.getUserProperties().put(BLOCKING_SEND_TIMEOUT_PROPERTY, sendTimeoutMs);
        }
    }
}
