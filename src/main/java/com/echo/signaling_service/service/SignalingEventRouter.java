package com.echo.signaling_service.service;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.CallInviteRequest;
import com.echo.signaling_service.dto.CallRefRequest;
import com.echo.signaling_service.dto.ChatMessageRequest;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.dto.InboundEvent;
import com.echo.signaling_service.dto.JoinRequest;
import com.echo.signaling_service.dto.JoinRoomRequest;
import com.echo.signaling_service.dto.SignalRequest;
import com.echo.signaling_service.enums.WireEvent;
import com.echo.signaling_service.utility.WireEventDecoder;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for inbound frames: decodes, validates and hands each event to the module
 * that owns it. Anything but {@code join} from a connection that has not joined yet is
 * dropped.
 */
@Slf4j
@Service
public class SignalingEventRouter {

    private static final int MAX_NAME_LENGTH = 64;

    private final WireEventDecoder decoder;
    private final ConnectionRegistryService connectionRegistry;
    private final PresenceService presenceService;
    private final RoomMembershipService roomMembership;
    private final MessageRelayService messageRelay;
    private final CallOrchestratorService callOrchestrator;
    private final SignalingProperties properties;

    public SignalingEventRouter(WireEventDecoder decoder, ConnectionRegistryService connectionRegistry,
            PresenceService presenceService, RoomMembershipService roomMembership,
            MessageRelayService messageRelay, CallOrchestratorService callOrchestrator,
            SignalingProperties properties) {
        this.decoder = decoder;
        this.connectionRegistry = connectionRegistry;
        this.presenceService = presenceService;
        this.roomMembership = roomMembership;
        this.messageRelay = messageRelay;
        this.callOrchestrator = callOrchestrator;
        this.properties = properties;
    }

    /**
     * @param authenticatedUserId subject of the connection's verified token, if any; it
     *                            overrides the userId a client claims on join
     */
    public void route(String connectionId, String authenticatedUserId, String frame) {
        Optional<InboundEvent> decoded = decoder.decode(frame);
        if (decoded.isEmpty()) {
            return;
        }
        InboundEvent inbound = decoded.get();
        WireEvent event = inbound.getEvent();

        if (event != WireEvent.JOIN && !connectionRegistry.isRegistered(connectionId)) {
            log.warn("Dropping '{}' from {}: connection has not joined", event.getWireName(), connectionId);
            return;
        }
        log.debug("RECV '{}' <- {}", event.getWireName(), connectionId);

        switch (event) {
            case JOIN:
                presenceService.join(connectionId, toIdentity(inbound.payloadAs(JoinRequest.class), authenticatedUserId));
                break;
            case JOIN_ROOM:
                roomMembership.join(connectionId, inbound.payloadAs(JoinRoomRequest.class).getRoom());
                break;
            case LEAVE_ROOM:
                roomMembership.leave(connectionId);
                break;
            case MESSAGE:
                relayMessage(connectionId, inbound.payloadAs(ChatMessageRequest.class));
                break;
            case WEBRTC_OFFER:
                callOrchestrator.offer(connectionId, inbound.payloadAs(SignalRequest.class));
                break;
            case WEBRTC_ANSWER:
                callOrchestrator.answer(connectionId, inbound.payloadAs(SignalRequest.class));
                break;
            case WEBRTC_ICE:
                callOrchestrator.ice(connectionId, inbound.payloadAs(SignalRequest.class));
                break;
            case WEBRTC_END:
                callOrchestrator.end(connectionId, inbound.payloadAs(SignalRequest.class));
                break;
            case CALL_INVITE:
                callOrchestrator.invite(connectionId, inbound.payloadAs(CallInviteRequest.class));
                break;
            case CALL_JOIN:
                callOrchestrator.join(inbound.payloadAs(CallRefRequest.class).getCallId(), connectionId);
                break;
            case CALL_LEAVE:
                callOrchestrator.leave(inbound.payloadAs(CallRefRequest.class).getCallId(), connectionId);
                break;
            case CALL_END_ALL:
                callOrchestrator.endAll(inbound.payloadAs(CallRefRequest.class).getCallId(), connectionId);
                break;
            case CALL_BUSY:
                callOrchestrator.busy(connectionId, inbound.payloadAs(SignalRequest.class));
                break;
            case CALL_UPGRADE:
                callOrchestrator.upgrade(connectionId, inbound.payloadAs(SignalRequest.class));
                break;
            case CALL_UPGRADE_RESPONSE:
                callOrchestrator.upgradeResponse(connectionId, inbound.payloadAs(SignalRequest.class));
                break;
            default:
                log.debug("No route for '{}'", event.getWireName());
        }
    }

    private void relayMessage(String connectionId, ChatMessageRequest request) {
        String text = request.getText();
        if (text == null || text.isBlank()) {
            log.debug("Dropping empty message from {}", connectionId);
            return;
        }
        if (text.length() > properties.getMaxMessageLength()) {
            log.warn("Dropping message from {}: {} chars exceeds {}", connectionId, text.length(),
                    properties.getMaxMessageLength());
            return;
        }
        messageRelay.publish(connectionId, text, request.getRoom());
    }

    static Identity toIdentity(JoinRequest request, String authenticatedUserId) {
        String name = request.getName() == null ? "" : request.getName().trim();
        if (name.isEmpty()) {
            name = ApplicationConstants.DEFAULT_DISPLAY_NAME;
        } else if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }
        String userId = authenticatedUserId;
        if (userId == null && request.getUserId() != null && !request.getUserId().isBlank()) {
            userId = request.getUserId().trim();
        }
        return new Identity(name, userId);
    }
}
