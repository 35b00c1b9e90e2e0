package com.echo.signaling_service.service;

import java.time.Clock;
import java.util.List;

import org.springframework.stereotype.Service;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.ChatMessage;
import com.echo.signaling_service.dto.DeliveryReceipt;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.repo.ChatStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Fans chat text out to a room (or everyone) and then persists it. Delivery never waits
 * on, or fails because of, the store.
 */
@Slf4j
@Service
public class MessageRelayService {

    private final ConnectionRegistryService connectionRegistry;
    private final RoomMembershipService roomMembership;
    private final SignalDispatcher dispatcher;
    private final ChatStore chatStore;
    private final Clock clock;

    public MessageRelayService(ConnectionRegistryService connectionRegistry, RoomMembershipService roomMembership,
            SignalDispatcher dispatcher, ChatStore chatStore, Clock clock) {
        this.connectionRegistry = connectionRegistry;
        this.roomMembership = roomMembership;
        this.dispatcher = dispatcher;
        this.chatStore = chatStore;
        this.clock = clock;
    }

    /**
     * @param targetRoom explicit room, or null for the sender's current room (global if none)
     */
    public DeliveryReceipt publish(String senderId, String text, String targetRoom) {
        String room = RoomMembershipService.normalizeRoom(targetRoom);
        if (room == null && targetRoom == null) {
            room = roomMembership.roomOf(senderId).orElse(null);
        }
        String name = connectionRegistry.lookup(senderId)
                .map(Identity::getName)
                .orElse(ApplicationConstants.DEFAULT_DISPLAY_NAME);
        long ts = clock.millis();

        ChatMessage message = ChatMessage.builder()
                .id(senderId)
                .name(name)
                .text(text)
                .ts(ts)
                .room(room)
                .build();

        List<String> audience = roomMembership.audienceOf(room);
        for (String recipient : audience) {
            dispatcher.send(recipient, ApplicationConstants.EVENT_MESSAGE, message);
        }

        boolean persisted = false;
        try {
            chatStore.appendMessage(name, text, ts, room);
            persisted = true;
        } catch (Exception e) {
            log.error("Failed to persist message from {} in room '{}': {}", senderId, room, e.getMessage());
        }

        log.debug("Relayed message from {} to {} recipient(s) in room '{}'", senderId, audience.size(), room);
        return new DeliveryReceipt(ts, room, audience.size(), persisted);
    }
}
