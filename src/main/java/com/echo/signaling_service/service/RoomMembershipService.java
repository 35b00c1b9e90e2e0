package com.echo.signaling_service.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.ConnectedUser;
import com.echo.signaling_service.dto.ConnectionClosedEvent;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.dto.OutboundSignal;
import com.echo.signaling_service.repo.PresenceStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Tracks which named room each connection is in. A connection is in at most one room;
 * connections in no room are in the global partition.
 */
@Slf4j
@Service
public class RoomMembershipService {

    private final Object lock = new Object();
    private final Map<String, String> roomByConnection = new HashMap<>();
    private final Map<String, Set<String>> membersByRoom = new HashMap<>();

    private final ConnectionRegistryService connectionRegistry;
    private final PresenceStore presenceStore;
    private final SignalDispatcher dispatcher;

    public RoomMembershipService(ConnectionRegistryService connectionRegistry, PresenceStore presenceStore,
            SignalDispatcher dispatcher) {
        this.connectionRegistry = connectionRegistry;
        this.presenceStore = presenceStore;
        this.dispatcher = dispatcher;
    }

    /**
     * "", null and the global alias all mean the global partition.
     */
    public static String normalizeRoom(String room) {
        if (room == null) {
            return null;
        }
        String trimmed = room.trim();
        if (trimmed.isEmpty() || ApplicationConstants.GLOBAL_ROOM_ALIAS.equalsIgnoreCase(trimmed)) {
            return null;
        }
        return trimmed;
    }

    /**
     * Moves the connection into {@code room}, leaving its previous room first.
     *
     * @return roster of the room joined (everyone connected for the global partition)
     */
    public List<ConnectedUser> join(String connectionId, String room) {
        String target = normalizeRoom(room);
        String name = displayName(connectionId);
        List<OutboundSignal> outbox = new ArrayList<>();
        String previous;
        List<ConnectedUser> roster;

        synchronized (lock) {
            previous = roomByConnection.get(connectionId);
            if (previous != null && previous.equals(target)) {
                roster = rosterLocked(target);
                outbox.add(new OutboundSignal(connectionId, ApplicationConstants.EVENT_USERS_IN_ROOM, roster));
                previous = null;
                target = null;
            } else {
                if (previous != null) {
                    removeLocked(connectionId, previous, name, outbox);
                }
                if (target != null) {
                    roomByConnection.put(connectionId, target);
                    membersByRoom.computeIfAbsent(target, r -> new LinkedHashSet<>()).add(connectionId);
                    roster = rosterLocked(target);
                    Map<String, Object> joined = roomEvent(connectionId, name, target);
                    for (String member : membersByRoom.get(target)) {
                        outbox.add(new OutboundSignal(member, ApplicationConstants.EVENT_ROOM_JOIN, joined));
                        outbox.add(new OutboundSignal(member, ApplicationConstants.EVENT_USERS_IN_ROOM, roster));
                    }
                } else {
                    roster = rosterLocked(null);
                }
            }
        }

        if (previous != null) {
            presenceStore.remove(ApplicationConstants.PRESENCE_ROOM_KEY_PREFIX + previous, connectionId);
            log.info("Connection {} left room '{}'", connectionId, previous);
        }
        if (target != null) {
            presenceStore.add(ApplicationConstants.PRESENCE_ROOM_KEY_PREFIX + target, connectionId);
            log.info("Connection {} joined room '{}'", connectionId, target);
        }
        dispatcher.sendAll(outbox);
        return roster;
    }

    /**
     * Returns the connection to the global partition.
     *
     * @return the room that was left, empty if it was in none
     */
    public Optional<String> leave(String connectionId) {
        String name = displayName(connectionId);
        List<OutboundSignal> outbox = new ArrayList<>();
        String previous;
        synchronized (lock) {
            previous = roomByConnection.get(connectionId);
            if (previous != null) {
                removeLocked(connectionId, previous, name, outbox);
            }
        }
        if (previous == null) {
            return Optional.empty();
        }
        presenceStore.remove(ApplicationConstants.PRESENCE_ROOM_KEY_PREFIX + previous, connectionId);
        log.info("Connection {} left room '{}'", connectionId, previous);
        dispatcher.sendAll(outbox);
        return Optional.of(previous);
    }

    public List<ConnectedUser> rosterOf(String room) {
        synchronized (lock) {
            return rosterLocked(normalizeRoom(room));
        }
    }

    public Optional<String> roomOf(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(roomByConnection.get(connectionId));
        }
    }

    /**
     * Connection ids that hear a broadcast addressed to {@code room}; every registered
     * connection for the global partition.
     */
    public List<String> audienceOf(String room) {
        String target = normalizeRoom(room);
        if (target == null) {
            return connectionRegistry.connectionIds();
        }
        synchronized (lock) {
            Set<String> members = membersByRoom.get(target);
            return members == null ? new ArrayList<>() : new ArrayList<>(members);
        }
    }

    @EventListener
    @Order(2)
    public void onConnectionClosed(ConnectionClosedEvent event) {
        leave(event.getConnectionId());
    }

    private void removeLocked(String connectionId, String room, String name, List<OutboundSignal> outbox) {
        roomByConnection.remove(connectionId);
        Set<String> members = membersByRoom.get(room);
        if (members == null) {
            return;
        }
        members.remove(connectionId);
        if (members.isEmpty()) {
            membersByRoom.remove(room);
            return;
        }
        List<ConnectedUser> roster = rosterLocked(room);
        Map<String, Object> left = roomEvent(connectionId, name, room);
        for (String member : members) {
            outbox.add(new OutboundSignal(member, ApplicationConstants.EVENT_ROOM_LEAVE, left));
            outbox.add(new OutboundSignal(member, ApplicationConstants.EVENT_USERS_IN_ROOM, roster));
        }
    }

    private List<ConnectedUser> rosterLocked(String room) {
        if (room == null) {
            return connectionRegistry.connectedUsers();
        }
        List<ConnectedUser> roster = new ArrayList<>();
        Set<String> members = membersByRoom.get(room);
        if (members == null) {
            return roster;
        }
        for (String member : members) {
            connectionRegistry.lookup(member).ifPresent(identity -> roster.add(ConnectedUser.of(member, identity)));
        }
        return roster;
    }

    private String displayName(String connectionId) {
        return connectionRegistry.lookup(connectionId)
                .map(Identity::getName)
                .orElse(ApplicationConstants.DEFAULT_DISPLAY_NAME);
    }

    private static Map<String, Object> roomEvent(String connectionId, String name, String room) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("id", connectionId);
        payload.put("name", name);
        payload.put("room", room);
        return payload;
    }
}
