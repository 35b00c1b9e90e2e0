package com.echo.signaling_service.service;

import java.util.Optional;

import com.echo.signaling_service.dto.TokenClaims;

/**
 * Issues and checks bearer tokens. Failures are reported as empty results, never thrown.
 */
public interface TokenVerifier {

    Optional<String> issue(String subject, long ttlSeconds);

    /**
     * @return the claims of a well-formed, correctly signed, unexpired token
     */
    Optional<TokenClaims> verify(String token);
}
