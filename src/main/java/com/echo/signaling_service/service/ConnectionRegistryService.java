package com.echo.signaling_service.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.ConnectedUser;
import com.echo.signaling_service.dto.ConnectionClosedEvent;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.repo.PresenceStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Authoritative map of live connection ids to the identity each one joined with.
 * Registration order is kept so that rosters come out in join order.
 */
@Slf4j
@Service
public class ConnectionRegistryService {

    // connectionId -> identity, guarded by this
    private final Map<String, Identity> identities = new LinkedHashMap<>();
    // connections whose disconnect cascade is running
    private final Set<String> closing = new HashSet<>();

    private final PresenceStore presenceStore;
    private final ApplicationEventPublisher eventPublisher;

    public ConnectionRegistryService(PresenceStore presenceStore, ApplicationEventPublisher eventPublisher) {
        this.presenceStore = presenceStore;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Stores or replaces the identity for a connection.
     *
     * @return true if the connection was not registered before
     */
    public boolean register(String connectionId, Identity identity) {
        Identity previous;
        synchronized (this) {
            if (closing.contains(connectionId)) {
                log.warn("Ignoring register for closing connection {}", connectionId);
                return false;
            }
            previous = identities.put(connectionId, identity);
        }

        presenceStore.add(ApplicationConstants.PRESENCE_GLOBAL_KEY, connectionId);
        if (identity.getUserId() != null) {
            presenceStore.add(ApplicationConstants.PRESENCE_USERS_KEY, identity.getUserId());
        }
        if (previous != null && previous.getUserId() != null
                && !previous.getUserId().equals(identity.getUserId())) {
            releaseUserId(previous.getUserId());
        }

        log.info("Registered connection {} as name='{}' userId='{}' (rejoin={})",
                connectionId, identity.getName(), identity.getUserId(), previous != null);
        return previous == null;
    }

    public synchronized Optional<Identity> lookup(String connectionId) {
        return Optional.ofNullable(identities.get(connectionId));
    }

    public synchronized boolean isRegistered(String connectionId) {
        return connectionId != null && identities.containsKey(connectionId);
    }

    /**
     * Runs the disconnect cascade for a connection and then releases it. A second call for
     * the same connection, or a call for an unknown one, is a no-op.
     *
     * @return the identity that was released
     */
    public Optional<Identity> unregister(String connectionId) {
        Identity identity;
        synchronized (this) {
            identity = identities.get(connectionId);
            if (identity == null || !closing.add(connectionId)) {
                log.debug("unregister: connection {} not registered or already closing", connectionId);
                return Optional.empty();
            }
        }

        try {
            eventPublisher.publishEvent(new ConnectionClosedEvent(connectionId, identity));
        } catch (RuntimeException e) {
            log.error("Disconnect cascade failed for {}: {}", connectionId, e.getMessage(), e);
        } finally {
            synchronized (this) {
                identities.remove(connectionId);
                closing.remove(connectionId);
            }
        }

        presenceStore.remove(ApplicationConstants.PRESENCE_GLOBAL_KEY, connectionId);
        if (identity.getUserId() != null) {
            releaseUserId(identity.getUserId());
        }
        log.info("Unregistered connection {} (name='{}')", connectionId, identity.getName());
        return Optional.of(identity);
    }

    /**
     * All registered connections in registration order.
     */
    public synchronized List<ConnectedUser> connectedUsers() {
        List<ConnectedUser> users = new ArrayList<>(identities.size());
        identities.forEach((id, identity) -> users.add(ConnectedUser.of(id, identity)));
        return users;
    }

    public synchronized List<String> connectionIds() {
        return new ArrayList<>(identities.keySet());
    }

    public synchronized boolean isUserOnline(String userId) {
        return userId != null && identities.values().stream().anyMatch(i -> userId.equals(i.getUserId()));
    }

    // the same userId may be held by several tabs; only drop it with the last one
    private void releaseUserId(String userId) {
        if (!isUserOnline(userId)) {
            presenceStore.remove(ApplicationConstants.PRESENCE_USERS_KEY, userId);
        }
    }
}
