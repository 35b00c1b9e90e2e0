package com.echo.signaling_service.controller;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.service.CallOrchestratorService;
import com.echo.signaling_service.service.PresenceService;
import com.echo.signaling_service.service.RoomMembershipService;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class PresenceController {

    private final PresenceService presenceService;
    private final CallOrchestratorService callOrchestrator;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> resp = new HashMap<>();
        resp.put("status", "Echo signaling server running");
        resp.put("connections", presenceService.connectedUsers().size());
        resp.put("calls", callOrchestrator.liveCallCount());
        return ResponseEntity.ok(resp);
    }

    /**
     * Connection ids marked present, globally or in {@code room}.
     */
    @GetMapping(ApplicationConstants.PRESENCE)
    public ResponseEntity<Map<String, Object>> presence(@RequestParam(required = false) String room) {
        List<String> ids = new ArrayList<>(presenceService.onlineConnections(room));
        Collections.sort(ids);
        Map<String, Object> resp = new HashMap<>();
        resp.put("room", RoomMembershipService.normalizeRoom(room));
        resp.put("ids", ids);
        return ResponseEntity.ok(resp);
    }

    @GetMapping(ApplicationConstants.USERS)
    public ResponseEntity<Map<String, Object>> users() {
        Map<String, Object> resp = new HashMap<>();
        resp.put("users", presenceService.connectedUsers());
        return ResponseEntity.ok(resp);
    }
}
