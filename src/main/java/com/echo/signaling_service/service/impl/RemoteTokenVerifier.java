package com.echo.signaling_service.service.impl;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.echo.signaling_service.config.AuthProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.TokenClaims;
import com.echo.signaling_service.service.TokenVerifier;
import com.echo.signaling_service.utility.CorrelationIdUtil;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Delegates to the external auth service: {@code POST /token} to issue and
 * {@code POST /token/verify} to verify. Verified claims are cached until they expire.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "auth.verifier", havingValue = "remote", matchIfMissing = true)
public class RemoteTokenVerifier implements TokenVerifier {

    private final RestTemplate restTemplate;
    private final CacheManager cacheManager;
    private final AuthProperties authProperties;
    private final Clock clock;

    public RemoteTokenVerifier(RestTemplate restTemplate, CacheManager cacheManager, AuthProperties authProperties,
            Clock clock) {
        this.restTemplate = restTemplate;
        this.cacheManager = cacheManager;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    @Override
    public Optional<String> issue(String subject, long ttlSeconds) {
        Map<String, Object> body = new HashMap<>();
        body.put("sub", subject);
        body.put("exp_seconds", ttlSeconds);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(authProperties.getUrl() + "/token",
                    HttpMethod.POST, new HttpEntity<>(body, headers()), JsonNode.class);
            JsonNode token = response.getBody() == null ? null : response.getBody().get("token");
            if (!response.getStatusCode().is2xxSuccessful() || token == null || !token.isTextual()) {
                log.warn("Auth service returned no token for sub={} (status={})", subject, response.getStatusCode());
                return Optional.empty();
            }
            return Optional.of(token.asText());
        } catch (RestClientException e) {
            log.error("Token issue failed for sub={}: {}", subject, ExceptionUtils.getRootCauseMessage(e));
            return Optional.empty();
        }
    }

    @Override
    public Optional<TokenClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        long nowSeconds = clock.millis() / 1000L;
        Cache cache = cacheManager.getCache(ApplicationConstants.TOKEN_CACHE);
        TokenClaims cached = cache == null ? null : cache.get(token, TokenClaims.class);
        if (cached != null) {
            if (!cached.isExpired(nowSeconds)) {
                return Optional.of(cached);
            }
            cache.evict(token);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("token", token);
        try {
            ResponseEntity<TokenClaims> response = restTemplate.exchange(authProperties.getUrl() + "/token/verify",
                    HttpMethod.POST, new HttpEntity<>(body, headers()), TokenClaims.class);
            TokenClaims claims = response.getBody();
            if (!response.getStatusCode().is2xxSuccessful() || claims == null || claims.getSub() == null
                    || claims.isExpired(nowSeconds)) {
                log.debug("Token rejected by auth service (status={})", response.getStatusCode());
                return Optional.empty();
            }
            if (cache != null) {
                cache.put(token, claims);
            }
            return Optional.of(claims);
        } catch (RestClientException e) {
            log.warn("Token verification failed: {}", ExceptionUtils.getRootCauseMessage(e));
            return Optional.empty();
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(CorrelationIdUtil.CORRELATION_ID_HEADER, CorrelationIdUtil.getOrCreate());
        return headers;
    }
}
