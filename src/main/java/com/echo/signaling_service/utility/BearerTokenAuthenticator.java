package com.echo.signaling_service.utility;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.TokenClaims;
import com.echo.signaling_service.service.TokenVerifier;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the caller of an HTTP request from its {@code Authorization: Bearer} header.
 */
@Slf4j
@Component
public class BearerTokenAuthenticator {

    private final TokenVerifier tokenVerifier;

    public BearerTokenAuthenticator(TokenVerifier tokenVerifier) {
        this.tokenVerifier = tokenVerifier;
    }

    /**
     * @throws ResponseStatusException 401 when the header is missing or the token is rejected
     */
    public TokenClaims authenticate(HttpHeaders headers) {
        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        String prefix = ApplicationConstants.BEARER_PREFIX;
        if (authHeader == null || !authHeader.regionMatches(true, 0, prefix, 0, prefix.length())) {
            log.warn("Missing or invalid Authorization header");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing Authorization");
        }
        String token = authHeader.substring(prefix.length()).trim();
        if (token.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing Authorization");
        }
        return tokenVerifier.verify(token).orElseThrow(() -> {
            log.warn("Rejected bearer token");
            return new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid token");
        });
    }
}
