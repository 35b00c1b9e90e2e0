package com.echo.signaling_service.utility;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.TokenClaims;
import com.echo.signaling_service.service.PresenceService;
import com.echo.signaling_service.service.SessionRegistryService;
import com.echo.signaling_service.service.SignalingEventRouter;
import com.echo.signaling_service.service.TokenVerifier;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class SignalingWebSocketHandler implements WebSocketHandler {

    private final TokenVerifier tokenVerifier;
    private final SignalingEventRouter eventRouter;
    private final SessionRegistryService sessionRegistryService;
    private final PresenceService presenceService;
    private final SignalingProperties properties;

    public SignalingWebSocketHandler(TokenVerifier tokenVerifier,
                                     SignalingEventRouter eventRouter,
                                     SessionRegistryService sessionRegistryService,
                                     PresenceService presenceService,
                                     SignalingProperties properties) {
        this.tokenVerifier = tokenVerifier;
        this.eventRouter = eventRouter;
        this.sessionRegistryService = sessionRegistryService;
        this.presenceService = presenceService;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        CorrelationIdUtil.begin("ws-" + session.getId());
        try {
            String token = getQueryParam(session, ApplicationConstants.TOKEN_QUERY_PARAM);
            if (token != null) {
                Optional<TokenClaims> claims = tokenVerifier.verify(token);
                if (claims.isEmpty()) {
                    log.warn("Invalid token on connection {}, closing", session.getId());
                    session.close(CloseStatus.POLICY_VIOLATION.withReason("invalid token"));
                    return;
                }
                session.getAttributes().put(ApplicationConstants.SESSION_ATTR_USER_ID, claims.get().getSub());
                log.info("Connection {} authenticated as userId={}", session.getId(), claims.get().getSub());
            } else if (properties.isRequireToken()) {
                log.warn("Connection {} without token rejected", session.getId());
                session.close(CloseStatus.POLICY_VIOLATION.withReason("token required"));
                return;
            }

            sessionRegistryService.registerSession(session);
            log.info("Connection {} established from {}", session.getId(), session.getRemoteAddress());
        } finally {
            CorrelationIdUtil.clear();
        }
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) throws Exception {
        CorrelationIdUtil.begin("ws-" + session.getId());
        try {
            if (!(message instanceof TextMessage)) {
                log.debug("Ignoring non-text frame on {}", session.getId());
                return;
            }
            String payload = ((TextMessage) message).getPayload();
            if (payload.contains(ApplicationConstants.PING_FRAME_MARKER)) {
                sessionRegistryService.sendRaw(session, ApplicationConstants.PONG_FRAME);
                return;
            }
            String userId = (String) session.getAttributes().get(ApplicationConstants.SESSION_ATTR_USER_ID);
            eventRouter.route(session.getId(), userId, payload);
        } catch (Exception e) {
            // keep the connection open; one bad frame must not drop the client
            log.error("Error handling frame on {}: {}", session.getId(), e.getMessage(), e);
        } finally {
            CorrelationIdUtil.clear();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("Transport error on {}: {}", session.getId(), exception.getMessage(), exception);
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) throws Exception {
        CorrelationIdUtil.begin("ws-" + session.getId());
        try {
            sessionRegistryService.unregisterSession(session.getId());
            presenceService.disconnect(session.getId());
            log.info("Connection {} closed (code={}, reason={})", session.getId(), closeStatus.getCode(),
                    closeStatus.getReason());
        } finally {
            CorrelationIdUtil.clear();
        }
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    private String getQueryParam(WebSocketSession session, String param) {
        String query = session.getUri() != null ? session.getUri().getRawQuery() : null;
        if (query != null) {
            for (String pair : query.split("&")) {
                String[] parts = pair.split("=", 2);
                if (parts.length == 2 && parts[0].equals(param) && !parts[1].isEmpty()) {
                    return URLDecoder.decode(parts[1], StandardCharsets.UTF_8);
                }
            }
        }
        return null;
    }
}
