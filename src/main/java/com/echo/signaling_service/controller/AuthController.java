package com.echo.signaling_service.controller;

import java.util.Optional;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.echo.signaling_service.config.AuthProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.LoginRequest;
import com.echo.signaling_service.dto.LoginResponse;
import com.echo.signaling_service.service.TokenVerifier;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping(ApplicationConstants.AUTH)
@RequiredArgsConstructor
public class AuthController {

    private final TokenVerifier tokenVerifier;
    private final AuthProperties authProperties;

    /**
     * POST /auth/login
     *
     * Issues a bearer token for {@code userId} (a random id when none is given). The token is accepted on the WebSocket
     * ({@code ?token=}) and on the contacts and call log endpoints.
     */
    @PostMapping(ApplicationConstants.LOGIN)
    public ResponseEntity<LoginResponse> login(@RequestBody(required = false) LoginRequest body) {
        LoginRequest request = body != null ? body : new LoginRequest();
        String userId = request.getUserId() == null || request.getUserId().isBlank()
                ? UUID.randomUUID().toString() : request.getUserId().trim();
        long ttl = request.getExpSeconds() != null ? request.getExpSeconds() : authProperties.getDefaultTtlSeconds();
        if (ttl <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "expSeconds must be positive");
        }

        Optional<String> token = tokenVerifier.issue(userId, ttl);
        if (token.isEmpty()) {
            log.error("login: token service did not issue a token for userId={}", userId);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(LoginResponse.builder().ok(false).build());
        }

        log.info("login: issued token for userId={} (ttl={}s)", userId, ttl);
        return ResponseEntity.ok(LoginResponse.builder()
                .ok(true)
                .token(token.get())
                .userId(userId)
                .name(request.getName())
                .build());
    }
}
