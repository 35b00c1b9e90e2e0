package com.echo.signaling_service.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.echo.signaling_service.config.AuthProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.utility.CorrelationIdUtil;

class RemoteTokenVerifierTest {

    private static final long NOW_SECONDS = 1_700_000_000L;

    private MockRestServiceServer server;
    private RemoteTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        AuthProperties properties = new AuthProperties();
        properties.setUrl("http://auth.local");
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW_SECONDS), ZoneOffset.UTC);
        verifier = new RemoteTokenVerifier(restTemplate, new ConcurrentMapCacheManager(ApplicationConstants.TOKEN_CACHE),
                properties, clock);
    }

    @Test
    void issuePostsSubjectAndTtl() {
        server.expect(requestTo("http://auth.local/token"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(CorrelationIdUtil.CORRELATION_ID_HEADER, notNullValue()))
                .andExpect(content().json("{\"sub\":\"user-1\",\"exp_seconds\":900}"))
                .andRespond(withSuccess("{\"token\":\"abc.def.ghi\"}", MediaType.APPLICATION_JSON));

        assertThat(verifier.issue("user-1", 900)).contains("abc.def.ghi");
        server.verify();
    }

    @Test
    void issueFailureIsEmpty() {
        server.expect(requestTo("http://auth.local/token")).andRespond(withServerError());

        assertThat(verifier.issue("user-1", 900)).isEmpty();
    }

    @Test
    void verifiedClaimsAreCachedUntilExpiry() {
        server.expect(once(), requestTo("http://auth.local/token/verify"))
                .andExpect(content().json("{\"token\":\"t1\"}"))
                .andRespond(withSuccess("{\"sub\":\"user-1\",\"exp\":" + (NOW_SECONDS + 60) + "}",
                        MediaType.APPLICATION_JSON));

        assertThat(verifier.verify("t1")).hasValueSatisfying(c -> assertThat(c.getSub()).isEqualTo("user-1"));
        assertThat(verifier.verify("t1")).isPresent();
        server.verify();
    }

    @Test
    void expiredOrRejectedTokensAreEmpty() {
        server.expect(requestTo("http://auth.local/token/verify"))
                .andRespond(withSuccess("{\"sub\":\"user-1\",\"exp\":" + (NOW_SECONDS - 1) + "}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://auth.local/token/verify"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThat(verifier.verify("old")).isEmpty();
        assertThat(verifier.verify("forged")).isEmpty();
        assertThat(verifier.verify(" ")).isEmpty();
        server.verify();
    }
}
