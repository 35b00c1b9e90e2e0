package com.echo.signaling_service.service.impl;

import java.time.Clock;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.echo.signaling_service.config.AuthProperties;
import com.echo.signaling_service.dto.TokenClaims;
import com.echo.signaling_service.service.TokenVerifier;
import com.echo.signaling_service.utility.JwtUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * In-process HS256 tokens, for deployments without a separate auth service.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "auth.verifier", havingValue = "local")
public class LocalTokenVerifier implements TokenVerifier {

    private final JwtUtil jwtUtil;

    public LocalTokenVerifier(AuthProperties authProperties, ObjectMapper objectMapper, Clock clock) {
        AuthProperties.Jwt jwt = authProperties.getJwt();
        this.jwtUtil = new JwtUtil(JwtUtil.parseSecrets(jwt.getSecrets(), jwt.getSecret()), jwt.getActiveKid(),
                objectMapper, clock);
    }

    LocalTokenVerifier(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    public Optional<String> issue(String subject, long ttlSeconds) {
        if (subject == null || subject.isBlank() || ttlSeconds <= 0) {
            log.warn("Refusing to issue token: sub={}, ttl={}", subject, ttlSeconds);
            return Optional.empty();
        }
        return Optional.of(jwtUtil.generateToken(subject, ttlSeconds));
    }

    @Override
    public Optional<TokenClaims> verify(String token) {
        return jwtUtil.parse(token);
    }
}
