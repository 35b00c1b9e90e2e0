package com.echo.signaling_service.utility;

import java.util.Set;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.echo.signaling_service.service.ConnectionRegistryService;
import com.echo.signaling_service.service.PresenceService;
import com.echo.signaling_service.service.SessionManager;

import lombok.extern.slf4j.Slf4j;

/**
 * Releases registered connections whose transport session is gone without a close
 * callback, so presence and calls never keep a dead connection.
 */
@Slf4j
@Component
public class HeartbeatScheduler {

    private final ConnectionRegistryService registryService;
    private final PresenceService presenceService;
    private final SessionManager sessionManager;

    public HeartbeatScheduler(ConnectionRegistryService registryService, PresenceService presenceService,
            SessionManager sessionManager) {
        this.registryService = registryService;
        this.presenceService = presenceService;
        this.sessionManager = sessionManager;
    }

    @Scheduled(fixedDelayString = "${signaling.stale-sweep-interval-ms:60000}")
    public void sweepStaleConnections() {
        Set<String> open = sessionManager.openConnectionIds();
        int released = 0;
        for (String connectionId : registryService.connectionIds()) {
            if (!open.contains(connectionId)) {
                log.warn("HeartbeatScheduler: releasing stale connection {}", connectionId);
                presenceService.disconnect(connectionId);
                released++;
            }
        }
        log.debug("HeartbeatScheduler: {} open session(s), {} stale released", open.size(), released);
    }
}
