package com.echo.signaling_service.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.Contact;
import com.echo.signaling_service.dto.ContactRequest;
import com.echo.signaling_service.dto.TokenClaims;
import com.echo.signaling_service.exception.RateLimitedException;
import com.echo.signaling_service.repo.ChatStore;
import com.echo.signaling_service.service.PresenceService;
import com.echo.signaling_service.service.RateLimiterService;
import com.echo.signaling_service.utility.BearerTokenAuthenticator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-owner contact lists.
 *
 * Authentication: all endpoints require Authorization Bearer <token>. The owner is the
 * token subject; naming a different ownerId is forbidden. Each owner is rate limited
 * per operation.
 */
@Slf4j
@RestController
@RequestMapping(ApplicationConstants.CONTACTS)
@RequiredArgsConstructor
public class ContactController {

    private static final int MAX_CONTACT_NAME_LENGTH = 128;

    private final BearerTokenAuthenticator authenticator;
    private final ChatStore chatStore;
    private final PresenceService presenceService;
    private final RateLimiterService rateLimiter;
    private final SignalingProperties properties;

    /**
     * GET /contacts?ownerId=
     *
     * Contacts sorted by name, each flagged online when its contact id has a live
     * connection.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listContacts(
            @RequestHeader HttpHeaders headers,
            @RequestParam(required = false) String ownerId) {
        String owner = resolveOwner(authenticator.authenticate(headers), ownerId);
        checkRate(ApplicationConstants.RATE_OP_CONTACTS_GET, owner);

        List<Contact> contacts = chatStore.listContacts(owner).stream()
                .map(c -> c.toBuilder().online(presenceService.isUserOnline(c.getContactId())).build())
                .collect(Collectors.toList());

        Map<String, Object> resp = new HashMap<>();
        resp.put("ok", true);
        resp.put("contacts", contacts);
        return ResponseEntity.ok(resp);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> upsertContact(
            @RequestHeader HttpHeaders headers,
            @RequestBody ContactRequest request) {
        String owner = resolveOwner(authenticator.authenticate(headers), request.getOwnerId());
        String name = trimToNull(request.getName());
        String contactId = trimToNull(request.getContactId());
        validateTarget(name, contactId);
        checkRate(ApplicationConstants.RATE_OP_CONTACTS_POST, owner);

        chatStore.upsertContact(owner, name, contactId);
        log.info("Contact saved for owner={} (name={}, contactId={})", owner, name, contactId);
        Map<String, Object> resp = new HashMap<>();
        resp.put("ok", true);
        return ResponseEntity.ok(resp);
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> deleteContact(
            @RequestHeader HttpHeaders headers,
            @RequestParam(required = false) String ownerId,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String contactId) {
        String owner = resolveOwner(authenticator.authenticate(headers), ownerId);
        String contactName = trimToNull(name);
        String id = trimToNull(contactId);
        validateTarget(contactName, id);
        checkRate(ApplicationConstants.RATE_OP_CONTACTS_DELETE, owner);

        boolean removed = chatStore.deleteContact(owner, contactName, id);
        log.info("Contact delete for owner={} (name={}, contactId={}) removed={}", owner, contactName, id, removed);
        Map<String, Object> resp = new HashMap<>();
        resp.put("ok", true);
        resp.put("removed", removed);
        return ResponseEntity.ok(resp);
    }

    private String resolveOwner(TokenClaims claims, String requestedOwner) {
        String owner = trimToNull(requestedOwner);
        if (owner != null && !owner.equals(claims.getSub())) {
            log.warn("Owner mismatch: token sub={} requested owner={}", claims.getSub(), owner);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Owner mismatch");
        }
        return claims.getSub();
    }

    private void validateTarget(String name, String contactId) {
        if (name == null && contactId == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "name or contactId is required");
        }
        if (name != null && name.length() > MAX_CONTACT_NAME_LENGTH) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "name must be at most " + MAX_CONTACT_NAME_LENGTH + " characters");
        }
    }

    private void checkRate(String operation, String owner) {
        String key = operation + ":" + owner;
        if (!rateLimiter.allow(key, properties.getRateLimit(), properties.getRateWindowMs())) {
            long retryMs = rateLimiter.retryAfterMs(key, properties.getRateLimit(), properties.getRateWindowMs());
            log.warn("Rate limited {} for owner={}", operation, owner);
            throw new RateLimitedException((retryMs + 999L) / 1000L);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
