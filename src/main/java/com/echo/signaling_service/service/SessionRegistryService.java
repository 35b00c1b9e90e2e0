package com.echo.signaling_service.service;

import java.io.IOException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import com.echo.signaling_service.dto.WireEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Transport side of a connection: connection id -> WebSocket session.
 */
@Slf4j
@Service
public class SessionRegistryService implements SessionManager, SignalDispatcher {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    // connectionId -> WebSocketSession
    private final Map<String, WebSocketSession> activeSessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public SessionRegistryService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void registerSession(WebSocketSession session) {
        if (session == null) return;
        activeSessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES));
        log.info("Registered transport session {}", session.getId());
    }

    public void unregisterSession(String connectionId) {
        if (connectionId == null) return;
        if (activeSessions.remove(connectionId) != null) {
            log.info("Unregistered transport session {}", connectionId);
        }
    }

    public WebSocketSession getSession(String connectionId) {
        return connectionId == null ? null : activeSessions.get(connectionId);
    }

    @Override
    public boolean isOpen(String connectionId) {
        WebSocketSession session = getSession(connectionId);
        return session != null && session.isOpen();
    }

    @Override
    public Set<String> openConnectionIds() {
        Set<String> open = new HashSet<>();
        activeSessions.forEach((id, session) -> {
            if (session.isOpen()) {
                open.add(id);
            }
        });
        return open;
    }

    @Override
    public void send(String connectionId, String event, Object payload) {
        WebSocketSession session = getSession(connectionId);
        if (session == null || !session.isOpen()) {
            log.debug("Dropping '{}' for {}: no open session", event, connectionId);
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(new WireEnvelope(event, objectMapper.valueToTree(payload)));
            session.sendMessage(new TextMessage(json));
            log.debug("SENT '{}' -> {}", event, connectionId);
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to deliver '{}' to {}: {}", event, connectionId, e.getMessage());
        }
    }

    /**
     * Raw frame outside the event envelope (heartbeat replies).
     */
    public void sendRaw(WebSocketSession session, String frame) {
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send raw frame to {}: {}", session.getId(), e.getMessage());
        }
    }
}
