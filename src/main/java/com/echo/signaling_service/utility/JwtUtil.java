package com.echo.signaling_service.utility;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.echo.signaling_service.dto.TokenClaims;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;

/**
 * HS256 signing and verification over a ring of keys addressed by {@code kid}. New tokens
 * are signed with the active key; any configured key is accepted when verifying, so keys
 * can be rotated without invalidating tokens already handed out.
 */
@Slf4j
public class JwtUtil {

    public static final String DEFAULT_KID = "default";
    private static final int MIN_SECRET_BYTES = 32;

    private final Map<String, Key> keys = new LinkedHashMap<>();
    private final String activeKid;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JwtUtil(Map<String, String> secretsByKid, String activeKid, ObjectMapper objectMapper, Clock clock) {
        if (secretsByKid == null || secretsByKid.isEmpty()) {
            throw new IllegalStateException("No JWT signing keys configured");
        }
        secretsByKid.forEach((kid, secret) -> {
            byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
            if (bytes.length < MIN_SECRET_BYTES) {
                throw new IllegalStateException("JWT secret for kid '" + kid + "' must be at least "
                        + MIN_SECRET_BYTES + " bytes");
            }
            keys.put(kid, Keys.hmacShaKeyFor(bytes));
        });
        this.activeKid = activeKid != null && !activeKid.isBlank() ? activeKid : keys.keySet().iterator().next();
        if (!keys.containsKey(this.activeKid)) {
            throw new IllegalStateException("Active JWT kid '" + this.activeKid + "' has no secret");
        }
        this.objectMapper = objectMapper;
        this.clock = clock;
        log.info("JWT key ring loaded: kids={}, active={}", keys.keySet(), this.activeKid);
    }

    /**
     * Parses {@code kid:secret,kid2:secret2}. Falls back to {@code fallbackSecret} under
     * {@value #DEFAULT_KID} when no pairs are given.
     */
    public static Map<String, String> parseSecrets(String secrets, String fallbackSecret) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (secrets != null) {
            for (String pair : secrets.split(",")) {
                int colon = pair.indexOf(':');
                if (colon <= 0 || colon == pair.length() - 1) {
                    if (!pair.isBlank()) {
                        log.warn("Ignoring malformed JWT secret entry (expected kid:secret)");
                    }
                    continue;
                }
                parsed.put(pair.substring(0, colon).trim(), pair.substring(colon + 1).trim());
            }
        }
        if (parsed.isEmpty() && fallbackSecret != null && !fallbackSecret.isBlank()) {
            parsed.put(DEFAULT_KID, fallbackSecret);
        }
        return parsed;
    }

    public String generateToken(String subject, long ttlSeconds) {
        long now = clock.millis();
        return Jwts.builder()
                .setHeaderParam("kid", activeKid)
                .setSubject(subject)
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(now + ttlSeconds * 1000L))
                .signWith(keys.get(activeKid), SignatureAlgorithm.HS256)
                .compact();
    }

    public Optional<TokenClaims> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String kid = readKid(token);
        Key key = kid == null ? null : keys.get(kid);
        if (key != null) {
            return parseWith(token, key);
        }
        // unknown or missing kid: try every key
        for (Key candidate : keys.values()) {
            Optional<TokenClaims> claims = parseWith(token, candidate);
            if (claims.isPresent()) {
                return claims;
            }
        }
        return Optional.empty();
    }

    public String getActiveKid() {
        return activeKid;
    }

    private Optional<TokenClaims> parseWith(String token, Key key) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            if (claims.getSubject() == null || claims.getExpiration() == null) {
                log.warn("JWT without sub or exp rejected");
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(claims.getSubject(), claims.getExpiration().getTime() / 1000L));
        } catch (ExpiredJwtException e) {
            log.warn("JWT expired for sub={} (exp={})", e.getClaims().getSubject(), e.getClaims().getExpiration());
        } catch (SignatureException e) {
            log.debug("JWT signature mismatch: {}", e.getMessage());
        } catch (MalformedJwtException e) {
            log.warn("Malformed JWT: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private String readKid(String token) {
        int dot = token.indexOf('.');
        if (dot <= 0) {
            return null;
        }
        try {
            byte[] header = Base64.getUrlDecoder().decode(token.substring(0, dot));
            JsonNode kid = objectMapper.readTree(header).get("kid");
            return kid != null && kid.isTextual() ? kid.asText() : null;
        } catch (Exception e) {
            log.debug("Unreadable JWT header: {}", e.getMessage());
            return null;
        }
    }
}
