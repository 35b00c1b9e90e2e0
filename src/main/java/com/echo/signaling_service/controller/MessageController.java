package com.echo.signaling_service.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.ChatMessage;
import com.echo.signaling_service.repo.ChatStore;
import com.echo.signaling_service.service.RoomMembershipService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping(ApplicationConstants.MESSAGES)
@RequiredArgsConstructor
public class MessageController {

    private final ChatStore chatStore;
    private final SignalingProperties properties;

    /**
     * GET /messages?room=&limit=
     *
     * Chat history, oldest first. Without a room the whole timeline is returned. The
     * limit is capped at the configured history limit.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> history(
            @RequestParam(required = false) String room,
            @RequestParam(required = false) Integer limit) {
        int max = properties.getMessageHistoryLimit();
        int n = limit == null || limit <= 0 ? max : Math.min(limit, max);
        String target = RoomMembershipService.normalizeRoom(room);

        List<ChatMessage> messages = chatStore.queryMessages(target, n);
        log.debug("History for room '{}': {} message(s)", target, messages.size());

        Map<String, Object> resp = new HashMap<>();
        resp.put("room", target);
        resp.put("messages", messages);
        return ResponseEntity.ok(resp);
    }
}
