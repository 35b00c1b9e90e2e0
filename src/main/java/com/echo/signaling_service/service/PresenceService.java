package com.echo.signaling_service.service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.ConnectedUser;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.repo.PresenceStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Announces joins and leaves to everyone connected and answers "who is online" from the
 * shared presence sets.
 */
@Slf4j
@Service
public class PresenceService {

    private final ConnectionRegistryService connectionRegistry;
    private final PresenceStore presenceStore;
    private final SignalDispatcher dispatcher;

    public PresenceService(ConnectionRegistryService connectionRegistry, PresenceStore presenceStore,
            SignalDispatcher dispatcher) {
        this.connectionRegistry = connectionRegistry;
        this.presenceStore = presenceStore;
        this.dispatcher = dispatcher;
    }

    /**
     * Registers (or renames) the connection, sends {@code user:join} to everyone else and the
     * full {@code users} list to everyone.
     */
    public List<ConnectedUser> join(String connectionId, Identity identity) {
        connectionRegistry.register(connectionId, identity);
        List<ConnectedUser> users = connectionRegistry.connectedUsers();

        Map<String, Object> joined = new HashMap<>();
        joined.put("id", connectionId);
        joined.put("name", identity.getName());
        for (ConnectedUser user : users) {
            if (!user.getId().equals(connectionId)) {
                dispatcher.send(user.getId(), ApplicationConstants.EVENT_USER_JOIN, joined);
            }
            dispatcher.send(user.getId(), ApplicationConstants.EVENT_USERS, users);
        }
        return users;
    }

    /**
     * Releases the connection (running the room and call cascades) and tells everyone left.
     */
    public Optional<Identity> disconnect(String connectionId) {
        Optional<Identity> released = connectionRegistry.unregister(connectionId);
        if (released.isEmpty()) {
            return released;
        }
        List<ConnectedUser> users = connectionRegistry.connectedUsers();
        Map<String, Object> left = new HashMap<>();
        left.put("id", connectionId);
        left.put("name", released.get().getName());
        for (ConnectedUser user : users) {
            dispatcher.send(user.getId(), ApplicationConstants.EVENT_USER_LEAVE, left);
            dispatcher.send(user.getId(), ApplicationConstants.EVENT_USERS, users);
        }
        return released;
    }

    public List<ConnectedUser> connectedUsers() {
        return connectionRegistry.connectedUsers();
    }

    /**
     * Connection ids marked present, globally or in one room.
     */
    public Set<String> onlineConnections(String room) {
        String target = RoomMembershipService.normalizeRoom(room);
        String key = target == null ? ApplicationConstants.PRESENCE_GLOBAL_KEY
                : ApplicationConstants.PRESENCE_ROOM_KEY_PREFIX + target;
        return presenceStore.members(key);
    }

    public Set<String> onlineUserIds() {
        return presenceStore.members(ApplicationConstants.PRESENCE_USERS_KEY);
    }

    public boolean isUserOnline(String userId) {
        return userId != null && presenceStore.contains(ApplicationConstants.PRESENCE_USERS_KEY, userId);
    }
}
