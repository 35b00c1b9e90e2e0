package com.echo.signaling_service.service.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.echo.signaling_service.dto.TokenClaims;
import com.echo.signaling_service.utility.JwtUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

class LocalTokenVerifierTest {

    private final LocalTokenVerifier verifier = new LocalTokenVerifier(new JwtUtil(
            Map.of("k1", "local-secret-local-secret-local-secret"), "k1", new ObjectMapper(),
            Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC)));

    @Test
    void issuedTokenVerifies() {
        String token = verifier.issue("user-9", 120).orElseThrow();

        assertThat(verifier.verify(token)).map(TokenClaims::getSub).contains("user-9");
    }

    @Test
    void refusesBlankSubjectOrNonPositiveTtl() {
        assertThat(verifier.issue(" ", 120)).isEmpty();
        assertThat(verifier.issue("user-9", 0)).isEmpty();
    }
}
