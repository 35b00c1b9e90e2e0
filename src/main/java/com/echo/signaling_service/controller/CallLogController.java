package com.echo.signaling_service.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.TokenClaims;
import com.echo.signaling_service.service.CallLogService;
import com.echo.signaling_service.utility.BearerTokenAuthenticator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping(ApplicationConstants.CALLS)
@RequiredArgsConstructor
public class CallLogController {

    private final BearerTokenAuthenticator authenticator;
    private final CallLogService callLogService;

    /**
     * GET /calls?limit=
     *
     * Most recent call log entries, oldest first. Requires a bearer token.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> recentCalls(
            @RequestHeader HttpHeaders headers,
            @RequestParam(required = false) Integer limit) {
        TokenClaims claims = authenticator.authenticate(headers);
        int n = limit == null ? callLogService.capacity() : Math.min(Math.max(limit, 0), callLogService.capacity());
        log.debug("Call log requested by {} (limit={})", claims.getSub(), n);

        Map<String, Object> resp = new HashMap<>();
        resp.put("logs", callLogService.recent(n));
        return ResponseEntity.ok(resp);
    }
}
